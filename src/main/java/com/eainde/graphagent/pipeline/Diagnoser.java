package com.eainde.graphagent.pipeline;

import com.eainde.graphagent.model.Diagnosis;
import com.eainde.graphagent.model.Failure;

import java.util.List;

/**
 * Classifies a chain of failures of the same step, oldest first.
 */
public interface Diagnoser {

    Diagnosis classify(List<Failure> failures);
}
