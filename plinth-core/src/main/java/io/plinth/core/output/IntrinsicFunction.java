package io.plinth.core.output;

/// Function expression embedded in a plan value and evaluated against live instance state.
///
/// @see FunctionParser
public sealed interface IntrinsicFunction permits GetAttribute {}
