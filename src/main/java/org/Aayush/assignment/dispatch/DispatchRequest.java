package org.Aayush.assignment.dispatch;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Drivers and destination addresses to pair up.
 *
 * <p>Labels must be non-blank and unique within their list. The lists may differ
 * in size; the surplus side is reported as unmatched.</p>
 */
@Value
@Builder
public class DispatchRequest {
    /** Driver names, one matrix row each. */
    @Singular("driver")
    List<String> drivers;
    /** Destination address lines, one matrix column each. */
    @Singular("address")
    List<String> addresses;
}
