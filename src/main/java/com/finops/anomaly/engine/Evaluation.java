package com.finops.anomaly.engine;

import com.finops.anomaly.model.AnomalyEvent;
import lombok.Value;

import java.util.List;

/**
 * Outcome of evaluating one sample: the events it produced and the model state it touched.
 */
@Value
public class Evaluation {
    List<AnomalyEvent> events;
    List<String> modelsUpdated;
}
