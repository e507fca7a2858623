package com.ipcsentinel.core.mediator;

import com.ipcsentinel.core.sender.SenderFrame;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-call metadata supplied by the IPC transport: who is calling and from
 * which frame. Optional attributes carry whatever the host's
 * {@link Authenticator} needs (session ids, tokens).
 *
 * @since 1.0.0
 */
public final class CallerContext {

    private final String senderId;
    private final SenderFrame frame;
    private final Map<String, Object> attributes;

    public CallerContext(String senderId, SenderFrame frame) {
        this(senderId, frame, null);
    }

    /**
     * @param senderId   transport-level id of the calling process or view
     * @param frame      calling frame; {@code null} if the transport has none,
     *                   which fails sender validation
     * @param attributes extra metadata, copied
     */
    public CallerContext(String senderId, SenderFrame frame, Map<String, ?> attributes) {
        this.senderId = Objects.requireNonNull(senderId, "senderId must not be null");
        this.frame = frame;
        this.attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Collections.emptyMap();
    }

    public String getSenderId() {
        return senderId;
    }

    public SenderFrame getFrame() {
        return frame;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Optional<Object> getAttribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    @Override
    public String toString() {
        return "CallerContext{senderId='" + senderId + "', frame=" + frame + '}';
    }
}
