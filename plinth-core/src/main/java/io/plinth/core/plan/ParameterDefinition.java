package io.plinth.core.plan;

import io.plinth.core.util.Values;

/// Declared workflow parameter.
///
/// A parameter without a default is mandatory. A default of `null` still counts as a
/// default, which is why presence is tracked separately from the value. Map and list defaults
/// are frozen at every level.
///
/// @param hasDefault whether the declaration carries a default value
/// @param defaultValue the default, meaningful only when `hasDefault` is true
/// @param description free text from the plan, may be null
public record ParameterDefinition(boolean hasDefault, Object defaultValue, String description) {

    public ParameterDefinition {
        defaultValue = Values.frozenValue(defaultValue);
    }

    /// Creates a mandatory parameter.
    ///
    /// @return definition without default, never null
    public static ParameterDefinition mandatory() {
        return new ParameterDefinition(false, null, null);
    }

    /// Creates an optional parameter with a default value.
    ///
    /// @param defaultValue the default, may be null
    /// @return definition with default, never null
    public static ParameterDefinition withDefault(Object defaultValue) {
        return new ParameterDefinition(true, defaultValue, null);
    }
}
