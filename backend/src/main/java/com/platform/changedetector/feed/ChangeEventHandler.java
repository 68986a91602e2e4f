package com.platform.changedetector.feed;

import com.platform.changedetector.model.ChangeEvent;

/**
 * Receives change events from the change-feed runner, one at a time and in emission order.
 * A slow handler holds back the feed; an exception is logged and the next handler still runs.
 */
public interface ChangeEventHandler {
    
    void onChange(ChangeEvent event);
    
    default String getName() {
        return getClass().getSimpleName();
    }
}
