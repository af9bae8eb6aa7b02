package com.customdim.service.core.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "customdim")
public class CustomDimensionsProperties {
    private Name name = new Name();
    private Extractions extractions = new Extractions();
    private Allocation allocation = new Allocation();
    private Cache cache = new Cache();
    private Tracker tracker = new Tracker();

    public Name getName() {
        return name;
    }

    public void setName(Name name) {
        this.name = name;
    }

    public Extractions getExtractions() {
        return extractions;
    }

    public void setExtractions(Extractions extractions) {
        this.extractions = extractions;
    }

    public Allocation getAllocation() {
        return allocation;
    }

    public void setAllocation(Allocation allocation) {
        this.allocation = allocation;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Tracker getTracker() {
        return tracker;
    }

    public void setTracker(Tracker tracker) {
        this.tracker = tracker;
    }

    public static class Name {
        private int maxLength = 255;

        public int getMaxLength() {
            return maxLength;
        }

        public void setMaxLength(int maxLength) {
            this.maxLength = maxLength;
        }
    }

    public static class Extractions {
        private int maxRules = 10;
        private int maxPatternLength = 255;

        public int getMaxRules() {
            return maxRules;
        }

        public void setMaxRules(int maxRules) {
            this.maxRules = maxRules;
        }

        public int getMaxPatternLength() {
            return maxPatternLength;
        }

        public void setMaxPatternLength(int maxPatternLength) {
            this.maxPatternLength = maxPatternLength;
        }
    }

    public static class Allocation {
        /** Attempts at allocate-then-insert before a slot conflict is reported as a persistence failure. */
        private int maxAttempts = 5;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }

    public static class Cache {
        private long siteMaximumSize = 10_000;
        private Duration siteTtl = Duration.ofMinutes(10);

        public long getSiteMaximumSize() {
            return siteMaximumSize;
        }

        public void setSiteMaximumSize(long siteMaximumSize) {
            this.siteMaximumSize = siteMaximumSize;
        }

        public Duration getSiteTtl() {
            return siteTtl;
        }

        public void setSiteTtl(Duration siteTtl) {
            this.siteTtl = siteTtl;
        }
    }

    public static class Tracker {
        private int maxValueLength = 255;

        public int getMaxValueLength() {
            return maxValueLength;
        }

        public void setMaxValueLength(int maxValueLength) {
            this.maxValueLength = maxValueLength;
        }
    }
}
