package com.mpl.application.port.out;

/**
 * Output port naming the user behind the current operation, for audit stamps only
 */
public interface IdentityProvider {

    String currentUser();
}
