// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public abstract class Errors {

    /// Create a one-line message consisting of only the exception class name and its message (if
    /// any). Some exceptions may be constructed with no message so getMessage returns null.
    /// Wrappers added by futures are removed first, as their messages just repeat the cause.
    public static String briefThrowableMessage (Throwable throwable) {
        Throwable cause = unwrap(throwable);
        String message = cause.getMessage();
        String className = cause.getClass().getSimpleName();
        if (message == null) {
            return className;
        } else {
            return className + ": " + message;
        }
    }

    public static Throwable unwrap (Throwable throwable) {
        Throwable t = throwable;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

}
