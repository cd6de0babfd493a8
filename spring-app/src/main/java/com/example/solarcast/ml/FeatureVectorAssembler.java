package com.example.solarcast.ml;

import org.springframework.stereotype.Component;

@Component
public class FeatureVectorAssembler {

    /** Lays the record out in {@link Feature} declaration order. */
    public FeatureVector assemble(FeatureRecord record) {
        Feature[] order = Feature.values();
        double[] x = new double[order.length];
        for (int i = 0; i < order.length; i++) {
            x[i] = order[i].valueOf(record);
        }
        return new FeatureVector(x);
    }
}
