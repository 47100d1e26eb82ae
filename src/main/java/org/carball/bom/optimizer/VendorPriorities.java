package org.carball.bom.optimizer;

import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;

/**
 * Tie-break order for vendor exclusion. Configured vendors keep their fixed priority; any other
 * vendor gets the next number from {@code autoStart} the first time it is seen, so the order is
 * stable for one run.
 */
@Slf4j
public class VendorPriorities {

    private final Map<String, Integer> priorities;
    private int nextPriority;

    public VendorPriorities(Map<String, Integer> fixedPriorities, int autoStart) {
        this.priorities = new HashMap<>(fixedPriorities);
        this.nextPriority = autoStart;
    }

    public int priorityOf(String vendorName) {
        Integer priority = priorities.get(vendorName);
        if (priority == null) {
            priority = nextPriority++;
            priorities.put(vendorName, priority);
            log.debug("Assigned priority {} to vendor {}", priority, vendorName);
        }
        return priority;
    }
}
