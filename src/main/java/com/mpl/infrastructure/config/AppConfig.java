package com.mpl.infrastructure.config;

import com.mpl.domain.model.MaternityCase;
import io.vertx.core.json.JsonObject;

/**
 * Typed view over application.json
 */
public class AppConfig {

    public static final String STORE_MEMORY = "memory";
    public static final String STORE_JDBC = "jdbc";

    private static final int DEFAULT_PORT = 8080;
    private static final int DEFAULT_HORIZON_MONTHS = 12;

    private final JsonObject config;

    public AppConfig(JsonObject config) {
        this.config = config != null ? config : new JsonObject();
    }

    public int httpPort() {
        return config.getJsonObject("http", new JsonObject()).getInteger("port", DEFAULT_PORT);
    }

    public String storeType() {
        return config.getJsonObject("store", new JsonObject()).getString("type", STORE_MEMORY);
    }

    public JsonObject database() {
        return config.getJsonObject("database");
    }

    public String calendarResource() {
        return config.getJsonObject("calendar", new JsonObject()).getString("resource", "payroll-calendar.json");
    }

    public String employeesResource() {
        return config.getJsonObject("employees", new JsonObject()).getString("resource", "employees.json");
    }

    public int defaultCmpWeeksEntitlement() {
        return config.getJsonObject("cmp", new JsonObject())
                .getInteger("defaultWeeksEntitlement", MaternityCase.DEFAULT_CMP_WEEKS_ENTITLEMENT);
    }

    public int selfCheckHorizonMonths() {
        return config.getJsonObject("selfCheck", new JsonObject()).getInteger("horizonMonths", DEFAULT_HORIZON_MONTHS);
    }

    public String defaultOperator() {
        return config.getJsonObject("identity", new JsonObject()).getString("defaultUser", "payroll-system");
    }

    public JsonObject raw() {
        return config;
    }
}
