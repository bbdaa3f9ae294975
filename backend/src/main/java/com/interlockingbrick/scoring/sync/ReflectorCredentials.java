package com.interlockingbrick.scoring.sync;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Connection settings for the reflector, as found in {@code sync.json}. */
public record ReflectorCredentials(@JsonProperty("sync_url") String syncUrl,
                                   @JsonProperty("event_code") String eventCode,
                                   @JsonProperty("apikey") String apikey) {

    public boolean isComplete() {
        return notBlank(syncUrl) && notBlank(eventCode) && notBlank(apikey);
    }

    /** {@code {syncUrl}/{eventCode}} without a doubled slash. */
    public String baseUrl() {
        String url = syncUrl.trim();
        while (url.endsWith("/")) url = url.substring(0, url.length() - 1);
        return url + "/" + eventCode.trim();
    }

    @Override
    public String toString() {
        return "ReflectorCredentials[syncUrl=" + syncUrl + ", eventCode=" + eventCode + ", apikey=***]";
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
