package org.openhab.binding.ewelink.internal.api;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.openhab.binding.ewelink.internal.model.AuthorizationCode;

/**
 * Supplies an authorization code captured outside the binding, usually by a person who opened the
 * authorization URL and copied the {@code code} parameter of the redirect.
 */
@NonNullByDefault
@FunctionalInterface
public interface AuthorizationCodeProvider {

    /**
     * @param authorizationUrl the signed OAuth page to present to the account owner
     * @return a freshly issued code
     * @throws EWeLinkApiException of kind {@link ErrorKind#UNAUTHENTICATED} if no code is available
     */
    AuthorizationCode obtainCode(String authorizationUrl) throws EWeLinkApiException;
}
