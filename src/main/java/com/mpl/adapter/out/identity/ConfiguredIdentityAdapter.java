package com.mpl.adapter.out.identity;

import com.mpl.application.port.out.IdentityProvider;

/**
 * Identity provider returning the operator configured for this deployment
 */
public class ConfiguredIdentityAdapter implements IdentityProvider {

    private final String operator;

    public ConfiguredIdentityAdapter(String operator) {
        this.operator = operator;
    }

    @Override
    public String currentUser() {
        return operator;
    }
}
