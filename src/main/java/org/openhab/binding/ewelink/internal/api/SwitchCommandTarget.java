package org.openhab.binding.ewelink.internal.api;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.openhab.binding.ewelink.internal.model.SwitchState;

/**
 * Something that switches a device on or off.
 */
@NonNullByDefault
@FunctionalInterface
public interface SwitchCommandTarget {

    void setState(String deviceId, SwitchState state) throws EWeLinkApiException;
}
