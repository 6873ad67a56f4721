package com.clapgrow.tracking.api.broadcast;

import com.clapgrow.tracking.api.dto.LiveEventFrame;

import java.io.IOException;

/**
 * Transport of one live subscriber.
 */
public interface FrameSink {

    /**
     * Writes one frame. An IOException means the client is gone and the subscriber is removed.
     */
    void send(LiveEventFrame frame) throws IOException;

    void close();
}
