package com.health.checker.notification;

import java.util.List;
import java.util.Objects;

/**
 * Addresses and links used when rendering notifications.
 *
 * @param serverEmail  sender address of outgoing e-mail
 * @param adminEmails  operators receiving every error, failure and recovery mail
 * @param pagingEmail  on-call address for HIGH severity checkers; null disables paging
 * @param alertChannel chat channel for failure alerts
 * @param siteUrl      base URL used to link to a run, without trailing slash
 */
public record NotificationSettings(
        String serverEmail,
        List<String> adminEmails,
        String pagingEmail,
        String alertChannel,
        String siteUrl
) {
    public NotificationSettings {
        Objects.requireNonNull(serverEmail, "serverEmail is required");
        adminEmails = adminEmails != null ? List.copyOf(adminEmails) : List.of();
        alertChannel = alertChannel != null && !alertChannel.isBlank() ? alertChannel : "#alerts";
        siteUrl = siteUrl != null ? stripTrailingSlash(siteUrl) : "";
    }

    public static NotificationSettings defaults() {
        return builder().build();
    }

    public boolean hasPagingEmail() {
        return pagingEmail != null && !pagingEmail.isBlank();
    }

    /**
     * Returns the link to a run's detail page.
     */
    public String runUrl(String checkerName, String runId) {
        return siteUrl + "/checkers/" + checkerName + "/runs/" + runId;
    }

    public String checkerUrl(String checkerName) {
        return siteUrl + "/checkers/" + checkerName;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String serverEmail = "checker@localhost";
        private List<String> adminEmails = List.of();
        private String pagingEmail;
        private String alertChannel = "#alerts";
        private String siteUrl = "http://localhost:8080";

        public Builder serverEmail(String serverEmail) {
            this.serverEmail = serverEmail;
            return this;
        }

        public Builder adminEmails(List<String> adminEmails) {
            this.adminEmails = adminEmails;
            return this;
        }

        public Builder pagingEmail(String pagingEmail) {
            this.pagingEmail = pagingEmail;
            return this;
        }

        public Builder alertChannel(String alertChannel) {
            this.alertChannel = alertChannel;
            return this;
        }

        public Builder siteUrl(String siteUrl) {
            this.siteUrl = siteUrl;
            return this;
        }

        public NotificationSettings build() {
            return new NotificationSettings(serverEmail, adminEmails, pagingEmail, alertChannel, siteUrl);
        }
    }
}
