package io.stagewise.core.state;

/// Merge function combining a patch value into the current value of a state field.
///
/// @param <T> the field type
@FunctionalInterface
public interface Reducer<T> {

    /// Combines the update into the current value.
    ///
    /// @param current the current field value, may be null
    /// @param update the patch value, may be null
    /// @return the merged value
    T reduce(T current, T update);
}
