package com.eainde.graphagent.pipeline;

import com.eainde.graphagent.model.Diagnosis;
import com.eainde.graphagent.model.Failure;
import com.eainde.graphagent.model.FailureClassification;
import com.eainde.graphagent.model.Remediation;
import lombok.extern.log4j.Log4j2;

import java.util.List;
import java.util.Objects;

/**
 * <ul>
 * <li>IDENTICAL: the two most recent failures have the same message, tool and
 * arguments. Remediation: escalate soon.</li>
 * <li>SYSTEMATIC: the most recent failure shares its tool and either its error
 * kind or its arguments with a failure at least two attempts back; the one
 * right before it does not count. Remediation: disclose more context.</li>
 * <li>RANDOM otherwise, including back-to-back failures that merely differ.
 * Remediation: plain retry.</li>
 * </ul>
 */
@Log4j2
public class FailurePatternDiagnoser implements Diagnoser {

    @Override
    public Diagnosis classify(List<Failure> failures) {
        if (failures == null || failures.isEmpty()) {
            return new Diagnosis(FailureClassification.RANDOM, Remediation.RETRY, "No failures recorded");
        }
        Failure latest = failures.get(failures.size() - 1);
        if (failures.size() >= 2 && latest.sameAs(failures.get(failures.size() - 2))) {
            int run = 1;
            for (int i = failures.size() - 2; i >= 0 && latest.sameAs(failures.get(i)); i--) {
                run++;
            }
            log.info("Identical failure repeated {} times: {}", run, latest.message());
            return new Diagnosis(FailureClassification.IDENTICAL, Remediation.ESCALATE_SOON,
                    "Same error repeated " + run + " times for " + latest.toolName() + ": " + latest.message());
        }
        for (int i = failures.size() - 3; i >= 0; i--) {
            Failure earlier = failures.get(i);
            if (!Objects.equals(earlier.toolName(), latest.toolName())) {
                continue;
            }
            if (earlier.kind() == latest.kind() || Objects.equals(earlier.arguments(), latest.arguments())) {
                log.info("Systematic failure pattern on {}", latest.toolName());
                return new Diagnosis(FailureClassification.SYSTEMATIC, Remediation.INCREASE_DISCLOSURE,
                        latest.toolName() + " keeps failing with " + latest.kind());
            }
        }
        return new Diagnosis(FailureClassification.RANDOM, Remediation.RETRY,
                "No recurring pattern in " + failures.size() + " failure(s)");
    }
}
