package org.carball.ckmetrics.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

/**
 * Report highlighting limits. A value above a warning limit is flagged, a value above a
 * critical limit is flagged harder. Loadable from YAML with snake_case keys.
 */
@Data
@Slf4j
public class MetricThresholds {

    public enum Severity {
        OK,
        WARNING,
        CRITICAL
    }

    @JsonProperty("lcom_warning")
    private int lcomWarning = 1;

    @JsonProperty("lcom_critical")
    private int lcomCritical = 3;

    @JsonProperty("wmc_warning")
    private int wmcWarning = 15;

    @JsonProperty("wmc_critical")
    private int wmcCritical = 30;

    @JsonProperty("dit_warning")
    private int ditWarning = 3;

    @JsonProperty("dit_critical")
    private int ditCritical = 4;

    @JsonProperty("noc_warning")
    private int nocWarning = 3;

    @JsonProperty("noc_critical")
    private int nocCritical = 5;

    public static MetricThresholds defaults() {
        return new MetricThresholds();
    }

    public Severity lcomSeverity(int lcom) {
        return severity(lcom, lcomWarning, lcomCritical);
    }

    public Severity wmcSeverity(int wmc) {
        return severity(wmc, wmcWarning, wmcCritical);
    }

    public Severity ditSeverity(int dit) {
        return severity(dit, ditWarning, ditCritical);
    }

    public Severity nocSeverity(int noc) {
        return severity(noc, nocWarning, nocCritical);
    }

    private static Severity severity(int value, int warning, int critical) {
        if (value > critical) return Severity.CRITICAL;
        if (value > warning) return Severity.WARNING;
        return Severity.OK;
    }

    /**
     * Logs warnings for limits that cannot highlight anything sensibly.
     */
    public void validate() {
        checkPair("LCOM", lcomWarning, lcomCritical);
        checkPair("WMC", wmcWarning, wmcCritical);
        checkPair("DIT", ditWarning, ditCritical);
        checkPair("NOC", nocWarning, nocCritical);

        if (lcomWarning < 1) {
            log.warn("LCOM warning limit ({}) flags fully cohesive classes", lcomWarning);
        }
    }

    private static void checkPair(String metric, int warning, int critical) {
        if (warning < 0 || critical < 0) {
            log.warn("{} limits should not be negative (warning {}, critical {})", metric, warning, critical);
        }
        if (critical <= warning) {
            log.warn("{} critical limit ({}) should be greater than warning limit ({})", metric, critical, warning);
        }
    }

    @JsonIgnore
    public String getDescription() {
        return String.format("Thresholds: lcom=%d/%d, wmc=%d/%d, dit=%d/%d, noc=%d/%d",
                lcomWarning, lcomCritical, wmcWarning, wmcCritical,
                ditWarning, ditCritical, nocWarning, nocCritical);
    }
}
