// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.util;

import java.util.function.Function;

/// The return value of an operation, containing either a result or an error.
///
/// Java has Optional and Either. The former is just like null in that it doesn't tell you why the
/// object is not present (failure or success with no object). The latter depends on the order (left
/// and right) so is not typesafe. In the pipeline, Optional is used where absence is a normal
/// outcome (a chunk that intersected no data), and Ret where absence needs an explanation that
/// should reach the task record (a whole fan-in group with no data, a failed validation).
///
/// Ok and Err are subclasses of abstract Ret as this avoids having an empty field in every
/// instance.
public abstract class Ret<T> {

    public boolean isErr () {
        return false;
    }

    public boolean isOk () {
        return false;
    }

    /// If the return value is Ok, returns the value. If it is an error, throw an exception.
    public final T get () {
        return getOrThrow(MissingReturnValueException::new);
    }

    public abstract T getOrThrow (Function<String, RuntimeException> exceptionFactory);

    /// Returns the error message. Will throw an exception if a return value is present instead of error.
    public abstract String errorMessage ();

    // Convenience factory methods to allow static imports and creating return values without using the 'new' operator.
    // That is: return ok(x); or return err("Description"); rather than return new Ret.Ok(x);

    public static <T> Ret<T> ok (T result) {
        return new Ok<>(result);
    }

    public static <T> Ret<T> err (String message) {
        return new Err<>(message);
    }

    /// An Ok or Err instance should never wrap a null reference. The whole point is to eliminate
    /// null references.
    private static void checkNotNull (Object o) {
        if (o == null) {
            throw new IllegalArgumentException("Supplied result or error must not be null.");
        }
    }

    // Java already defines an Error type, which essentially means "very bad exception you should not catch".
    // Use a different name (Err), scoped as an inner class of Ret to avoid confusion with this Error type.

    /// When the outcome of an operation is failure, an Err instance must be provided to explain why.
    /// This is parameterized T only to match the method signature of get(), even though T is never
    /// used due to throw.
    public static final class Err<T> extends Ret<T> {
        public final String message; // Cannot be null.

        public Err (String message) {
            checkNotNull(message);
            this.message = message;
        }

        @Override
        public boolean isErr () {
            return true;
        }

        @Override
        public T getOrThrow (Function<String, RuntimeException> exceptionFactory) {
            throw exceptionFactory.apply(message);
        }

        @Override
        public String errorMessage () {
            return message;
        }

        @Override
        public String toString () {
            return "Err<%s>".formatted(message);
        }
    }

    public static final class Ok<T> extends Ret<T> {
        public final T result; // Cannot be null.

        public Ok (T result) {
            checkNotNull(result);
            this.result = result;
        }

        @Override
        public boolean isOk () {
            return true;
        }

        @Override
        public T getOrThrow (Function<String, RuntimeException> exceptionFactory) {
            return result;
        }

        @Override
        public String errorMessage () {
            throw new IllegalStateException("This is not an error, so has no error message.");
        }

        @Override
        public String toString () {
            return "Ok<%s>".formatted(result.toString());
        }
    }

}
