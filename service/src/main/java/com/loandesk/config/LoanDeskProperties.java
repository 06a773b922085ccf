package com.loandesk.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Locale;

/**
 * {@code loandesk.*} settings from application.yml.
 */
@ConfigurationProperties(prefix = "loandesk")
@Getter
@Setter
public class LoanDeskProperties {

    private Storage storage = new Storage();
    private Scheduler scheduler = new Scheduler();
    private Pagination pagination = new Pagination();
    private Statistics statistics = new Statistics();

    @Getter
    @Setter
    public static class Storage {
        /**
         * Directory files are written under.
         */
        private String root = "./storage";
        /**
         * Prefix of the URLs handed out for stored files.
         */
        private String publicUrl = "http://localhost:8080/files";
        private long maxFileSizeBytes = 10 * 1024 * 1024;
    }

    @Getter
    @Setter
    public static class Scheduler {
        private boolean enabled = true;
        /**
         * Daily trigger of the commission snapshot job. {@code -} disables it.
         */
        private String snapshotCron = "0 0 1 * * *";
    }

    @Getter
    @Setter
    public static class Pagination {
        private int defaultPageSize = 20;
        private int maxPageSize = 100;
    }

    @Getter
    @Setter
    public static class Statistics {
        /**
         * Decides the first day of a WEEK bucket.
         */
        private Locale weekLocale = Locale.US;
    }
}
