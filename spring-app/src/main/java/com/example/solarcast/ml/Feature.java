package com.example.solarcast.ml;

import java.util.Arrays;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Model input columns in the exact order the scaler and regressor were fitted on.
 * <p>
 * Declaration order IS the vector layout. Reordering these constants shifts every
 * column the model sees and silently corrupts predictions; {@code FeatureVectorAssemblerTest}
 * pins the order.
 */
public enum Feature {
    TEMPERATURE("temperature", "temperature", FeatureRecord::temperature),
    HUMIDITY("humidity", "humidity", FeatureRecord::humidity),
    GHI("ghi", "ghi", FeatureRecord::ghi),
    HOUR_SIN("hour_sin", "hourSin", FeatureRecord::hourSin),
    HOUR_COS("hour_cos", "hourCos", FeatureRecord::hourCos),
    POWER_T_1("power_t_1", "powerT1", FeatureRecord::powerT1),
    POWER_T_2("power_t_2", "powerT2", FeatureRecord::powerT2);

    private final String column;
    private final String property;
    private final ToDoubleFunction<FeatureRecord> accessor;

    Feature(String column, String property, ToDoubleFunction<FeatureRecord> accessor) {
        this.column = column;
        this.property = property;
        this.accessor = accessor;
    }

    /** Training column name, also the JSON field name on the wire. */
    public String column() { return column; }

    /** Java property name on the request DTO. */
    public String property() { return property; }

    public double valueOf(FeatureRecord record) {
        return accessor.applyAsDouble(record);
    }

    public static List<String> columns() {
        return Arrays.stream(values()).map(Feature::column).toList();
    }
}
