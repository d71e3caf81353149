package com.celesteos.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "celeste.router")
public class RouterProperties {

    private int maxQueryLength = 2000;
    private PasteDump pasteDump = new PasteDump();

    public int getMaxQueryLength() {
        return maxQueryLength;
    }

    public void setMaxQueryLength(int maxQueryLength) {
        this.maxQueryLength = maxQueryLength;
    }

    public PasteDump getPasteDump() {
        return pasteDump;
    }

    public void setPasteDump(PasteDump pasteDump) {
        this.pasteDump = pasteDump;
    }

    /** Long, mostly non-alphabetic input (logs, hex, stack traces) is not a question. */
    public static class PasteDump {
        private int minLength = 100;
        private double minAlphaRatio = 0.5;

        public int getMinLength() {
            return minLength;
        }

        public void setMinLength(int minLength) {
            this.minLength = minLength;
        }

        public double getMinAlphaRatio() {
            return minAlphaRatio;
        }

        public void setMinAlphaRatio(double minAlphaRatio) {
            this.minAlphaRatio = minAlphaRatio;
        }
    }
}
