package com.example.solarcast.ml;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Tree ensemble exported from scikit-learn's {@code RandomForestRegressor}: one entry per
 * estimator with the flat {@code tree_} arrays. Prediction is the mean of the leaf values.
 */
public record RandomForestRegressor(@JsonProperty("trees") List<Tree> trees) implements FittedRegressor {

    static final int LEAF = -1;

    @Override
    public double predict(double[] scaled) {
        double sum = 0.0;
        for (Tree tree : trees) {
            sum += tree.predict(scaled);
        }
        return sum / trees.size();
    }

    @Override
    public String algorithm() {
        return "random_forest";
    }

    @Override
    public void verify() {
        if (trees == null || trees.isEmpty()) {
            throw new IllegalStateException("random forest has no trees");
        }
        for (int i = 0; i < trees.size(); i++) {
            try {
                trees.get(i).verify();
            } catch (IllegalStateException e) {
                throw new IllegalStateException("tree " + i + ": " + e.getMessage(), e);
            }
        }
    }

    /**
     * Node {@code n} is a leaf iff {@code childrenLeft[n] == -1}; otherwise go left when
     * {@code x[feature[n]] <= threshold[n]}. {@code value} holds the per-node mean target.
     */
    public record Tree(
            @JsonProperty("children_left") int[] childrenLeft,
            @JsonProperty("children_right") int[] childrenRight,
            @JsonProperty("feature") int[] feature,
            @JsonProperty("threshold") double[] threshold,
            @JsonProperty("value") double[] value) {

        double predict(double[] x) {
            int node = 0;
            // a well-formed tree reaches a leaf in fewer steps than it has nodes
            for (int steps = 0; steps < childrenLeft.length; steps++) {
                if (childrenLeft[node] == LEAF) {
                    return value[node];
                }
                int column = feature[node];
                if (column < 0 || column >= x.length) {
                    throw new IllegalArgumentException("split on column " + column
                            + " but vector has " + x.length + " entries");
                }
                node = x[column] <= threshold[node] ? childrenLeft[node] : childrenRight[node];
            }
            throw new IllegalStateException("tree walk did not reach a leaf");
        }

        void verify() {
            if (childrenLeft == null || childrenRight == null || feature == null
                    || threshold == null || value == null || childrenLeft.length == 0) {
                throw new IllegalStateException("missing or empty node arrays");
            }
            int n = childrenLeft.length;
            if (childrenRight.length != n || feature.length != n || threshold.length != n || value.length != n) {
                throw new IllegalStateException("node arrays differ in length");
            }
            for (int i = 0; i < n; i++) {
                boolean leaf = childrenLeft[i] == LEAF;
                if (leaf != (childrenRight[i] == LEAF)) {
                    throw new IllegalStateException("node " + i + " has exactly one child");
                }
                if (!leaf && (outOfRange(childrenLeft[i], n) || outOfRange(childrenRight[i], n))) {
                    throw new IllegalStateException("node " + i + " points outside the tree");
                }
            }
        }

        private static boolean outOfRange(int child, int n) {
            return child <= 0 || child >= n;
        }
    }
}
