package com.mpl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mpl.adapter.in.web.WebRouter;
import com.mpl.adapter.in.web.calendar.CalendarHandler;
import com.mpl.adapter.in.web.maternitycase.MaternityCaseHandler;
import com.mpl.adapter.in.web.period.PeriodHandler;
import com.mpl.adapter.in.web.query.CaseQueryHandler;
import com.mpl.adapter.in.web.recalculate.RecalculateHandler;
import com.mpl.adapter.out.calendar.JsonPayrollCalendarAdapter;
import com.mpl.adapter.out.employee.JsonEmployeeDirectoryAdapter;
import com.mpl.adapter.out.identity.ConfiguredIdentityAdapter;
import com.mpl.adapter.out.persistence.InMemoryCaseRepositoryAdapter;
import com.mpl.adapter.out.persistence.JdbcCaseRepositoryAdapter;
import com.mpl.application.port.out.CaseRepository;
import com.mpl.application.port.out.EmployeeDirectory;
import com.mpl.application.port.out.IdentityProvider;
import com.mpl.application.port.out.PayrollCalendarSource;
import com.mpl.application.service.CalendarCheckUseCaseImpl;
import com.mpl.application.service.CaseLedgerService;
import com.mpl.application.service.CaseQueryUseCaseImpl;
import com.mpl.application.service.CaseValidator;
import com.mpl.application.service.MaternityCaseUseCaseImpl;
import com.mpl.application.service.PeriodAmountsUseCaseImpl;
import com.mpl.application.service.RecalculateUseCaseImpl;
import com.mpl.domain.service.CmpCalculator;
import com.mpl.domain.service.PeriodGenerator;
import com.mpl.infrastructure.config.AppConfig;
import com.mpl.infrastructure.config.JacksonConfig;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.ext.web.handler.LoggerHandler;
import io.vertx.jdbcclient.JDBCPool;
import io.vertx.sqlclient.SqlClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * HTTP Server Verticle - wires adapters and services and serves the REST API
 */
public class HttpServerVerticle extends AbstractVerticle {
    private static final Logger log = LoggerFactory.getLogger(HttpServerVerticle.class);

    private AppConfig appConfig;
    private SqlClient sqlClient;
    private MaternityCaseHandler caseHandler;
    private PeriodHandler periodHandler;
    private RecalculateHandler recalculateHandler;
    private CaseQueryHandler queryHandler;
    private CalendarHandler calendarHandler;

    @Override
    public void start(Promise<Void> startPromise) {
        log.info("Starting HTTP Server Verticle...");
        appConfig = new AppConfig(config());

        initializeCaseStore()
                .compose(caseRepository -> {
                    initializeServices(caseRepository);
                    return startHttpServer();
                })
                .onSuccess(v -> {
                    log.info("HTTP Server Verticle started successfully on port {}", appConfig.httpPort());
                    startPromise.complete();
                })
                .onFailure(error -> {
                    log.error("Failed to start HTTP Server Verticle", error);
                    startPromise.fail(error);
                });
    }

    @Override
    public void stop() {
        if (sqlClient != null) {
            sqlClient.close();
        }
        log.info("HTTP Server Verticle stopped");
    }

    private Future<CaseRepository> initializeCaseStore() {
        ObjectMapper mapper = JacksonConfig.objectMapper();
        String storeType = appConfig.storeType();

        if (AppConfig.STORE_MEMORY.equals(storeType)) {
            log.info("Using in-memory case store");
            return Future.succeededFuture(new InMemoryCaseRepositoryAdapter(mapper));
        }
        if (!AppConfig.STORE_JDBC.equals(storeType)) {
            return Future.failedFuture(new IllegalStateException("Unknown store.type: " + storeType));
        }

        JsonObject dbConfig = appConfig.database();
        if (dbConfig == null) {
            return Future.failedFuture(new IllegalStateException("Database configuration not found in application.json"));
        }

        log.info("Connecting to database: {}", dbConfig.getString("url"));

        JsonObject poolConfig = new JsonObject()
                .put("url", dbConfig.getString("url"))
                .put("user", dbConfig.getString("user"))
                .put("password", dbConfig.getString("password"))
                .put("driver_class", dbConfig.getString("driver_class"))
                .put("max_pool_size", dbConfig.getInteger("max_pool_size", 10));

        sqlClient = JDBCPool.pool(vertx, poolConfig);

        return sqlClient.query(dbConfig.getString("test_query", "SELECT 1 FROM DUAL")).execute()
                .onSuccess(result -> log.info("Database connection test successful"))
                .onFailure(error -> log.error("Database connection failed", error))
                .map(result -> new JdbcCaseRepositoryAdapter(sqlClient, mapper));
    }

    private void initializeServices(CaseRepository caseRepository) {
        ObjectMapper mapper = JacksonConfig.objectMapper();
        Clock clock = Clock.systemDefaultZone();

        // Outbound adapters
        PayrollCalendarSource calendarSource = new JsonPayrollCalendarAdapter(appConfig.calendarResource(), mapper);
        EmployeeDirectory employeeDirectory = new JsonEmployeeDirectoryAdapter(appConfig.employeesResource(), mapper);
        IdentityProvider identityProvider = new ConfiguredIdentityAdapter(appConfig.defaultOperator());

        // Domain services
        CaseValidator validator = new CaseValidator();
        CmpCalculator cmpCalculator = new CmpCalculator();
        CaseLedgerService ledgerService = new CaseLedgerService(caseRepository, calendarSource, new PeriodGenerator());

        // Use cases
        MaternityCaseUseCaseImpl caseUseCase = new MaternityCaseUseCaseImpl(validator, caseRepository,
                employeeDirectory, identityProvider, ledgerService, cmpCalculator, clock,
                appConfig.defaultCmpWeeksEntitlement());
        PeriodAmountsUseCaseImpl periodUseCase = new PeriodAmountsUseCaseImpl(validator, caseRepository,
                identityProvider, ledgerService, cmpCalculator, clock);
        RecalculateUseCaseImpl recalculateUseCase = new RecalculateUseCaseImpl(caseRepository, ledgerService,
                cmpCalculator, identityProvider, clock);
        CaseQueryUseCaseImpl queryUseCase = new CaseQueryUseCaseImpl(caseRepository, ledgerService, clock);
        CalendarCheckUseCaseImpl calendarUseCase = new CalendarCheckUseCaseImpl(calendarSource, clock,
                appConfig.selfCheckHorizonMonths());

        // Handlers
        caseHandler = new MaternityCaseHandler(caseUseCase);
        periodHandler = new PeriodHandler(periodUseCase);
        recalculateHandler = new RecalculateHandler(recalculateUseCase);
        queryHandler = new CaseQueryHandler(queryUseCase);
        calendarHandler = new CalendarHandler(calendarUseCase);

        log.info("Services initialized successfully");
    }

    private Future<Void> startHttpServer() {
        Router router = Router.router(vertx);

        // Global handlers
        router.route().handler(LoggerHandler.create());
        router.route().handler(BodyHandler.create());

        new WebRouter(router, caseHandler, periodHandler, recalculateHandler, queryHandler, calendarHandler)
                .setupRoutes();

        // Default route - 404
        router.route().handler(ctx -> ctx.response()
                .setStatusCode(404)
                .putHeader("Content-Type", "application/json")
                .end(new JsonObject()
                        .put("status", "error")
                        .put("message", "Endpoint not found")
                        .encode()));

        int port = appConfig.httpPort();
        return vertx.createHttpServer()
                .requestHandler(router)
                .listen(port)
                .onSuccess(server -> log.info("HTTP server listening on port {}", port))
                .mapEmpty();
    }
}
