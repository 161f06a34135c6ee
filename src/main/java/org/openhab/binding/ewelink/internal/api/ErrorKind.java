package org.openhab.binding.ewelink.internal.api;

/**
 * Classification of failures reported by the eWeLink cloud or the transport.
 */
public enum ErrorKind {
    /** The provider rejected the request signature ("sign verification failed"). */
    SIGNATURE_REJECTED,
    /** The provider rejected the authorization code itself, e.g. because it expired. */
    CODE_EXPIRED_OR_INVALID,
    /** The authorization code was already consumed or terminally rejected; a new code is required. */
    AUTHORIZATION_CODE_EXHAUSTED,
    /** The provider rejected the account credentials of a password login. */
    CREDENTIALS_REJECTED,
    /** Connection failure or timeout. */
    NETWORK_UNAVAILABLE,
    /** Non-2xx HTTP status. */
    HTTP_ERROR,
    /** Non-JSON body or missing envelope fields. */
    MALFORMED_RESPONSE,
    /** Provider-level error on a device command or query. */
    DEVICE_COMMAND_REJECTED,
    /** The access token is expired and must be refreshed or re-acquired. */
    TOKEN_EXPIRED,
    /** No token is available. */
    UNAUTHENTICATED,
    /** A token was about to be presented to a region that did not issue it. */
    REGION_MISMATCH,
    /** The operation was cancelled by the caller. */
    CANCELLED
}
