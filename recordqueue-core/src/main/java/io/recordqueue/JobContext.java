package io.recordqueue;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Optional request metadata attached to a job: who is acting, why, and where the
 * request came from.
 *
 * <p>Only {@code delete} jobs require a field ({@link #actingAdminId()}); everything
 * else is informational and ends up in logs and dead-letter records.
 */
public final class JobContext {
    private final String actingAdminId;
    private final String reason;
    private final String userAgent;
    private final String ipAddress;
    private final Instant requestedAt;

    private JobContext(Builder builder) {
        this.actingAdminId = builder.actingAdminId;
        this.reason = builder.reason;
        this.userAgent = builder.userAgent;
        this.ipAddress = builder.ipAddress;
        this.requestedAt = builder.requestedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Shortcut for a moderation context carrying only the acting admin and a reason.
     *
     * @param actingAdminId the admin performing the action
     * @param reason        free-text reason, may be {@code null}
     * @return a new context
     */
    public static JobContext ofAdmin(String actingAdminId, String reason) {
        return builder().actingAdminId(actingAdminId).reason(reason).build();
    }

    public String actingAdminId() {
        return actingAdminId;
    }

    public String reason() {
        return reason;
    }

    public String userAgent() {
        return userAgent;
    }

    public String ipAddress() {
        return ipAddress;
    }

    public Instant requestedAt() {
        return requestedAt;
    }

    /**
     * Returns the non-null fields as an ordered, unmodifiable map.
     *
     * @return context fields keyed by name
     */
    public Map<String, String> toMap() {
        Map<String, String> map = new LinkedHashMap<>();
        putIfPresent(map, "actingAdminId", actingAdminId);
        putIfPresent(map, "reason", reason);
        putIfPresent(map, "userAgent", userAgent);
        putIfPresent(map, "ipAddress", ipAddress);
        if (requestedAt != null) {
            map.put("requestedAt", requestedAt.toString());
        }
        return Collections.unmodifiableMap(map);
    }

    private static void putIfPresent(Map<String, String> map, String key, String value) {
        if (value != null) {
            map.put(key, value);
        }
    }

    @Override
    public String toString() {
        return "JobContext" + toMap();
    }

    /** Builder for {@link JobContext}. All fields are optional. */
    public static final class Builder {
        private String actingAdminId;
        private String reason;
        private String userAgent;
        private String ipAddress;
        private Instant requestedAt;

        private Builder() {
        }

        public Builder actingAdminId(String actingAdminId) {
            this.actingAdminId = actingAdminId;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder ipAddress(String ipAddress) {
            this.ipAddress = ipAddress;
            return this;
        }

        public Builder requestedAt(Instant requestedAt) {
            this.requestedAt = requestedAt;
            return this;
        }

        public JobContext build() {
            return new JobContext(this);
        }
    }
}
