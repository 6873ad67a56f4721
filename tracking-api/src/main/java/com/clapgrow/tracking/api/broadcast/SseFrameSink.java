package com.clapgrow.tracking.api.broadcast;

import com.clapgrow.tracking.api.dto.LiveEventFrame;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/**
 * Server-Sent Events transport. Each frame is one {@code engagement} event with a JSON body.
 */
@Slf4j
public class SseFrameSink implements FrameSink {

    static final String EVENT_NAME = "engagement";

    private final SseEmitter emitter;

    public SseFrameSink(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void send(LiveEventFrame frame) throws IOException {
        try {
            emitter.send(SseEmitter.event().name(EVENT_NAME).data(frame, MediaType.APPLICATION_JSON));
        } catch (IllegalStateException e) {
            // Emitter already completed by a timeout or client disconnect
            throw new IOException("SSE emitter is closed", e);
        }
    }

    @Override
    public void close() {
        try {
            emitter.complete();
        } catch (IllegalStateException e) {
            log.debug("SSE emitter already completed: {}", e.getMessage());
        }
    }
}
