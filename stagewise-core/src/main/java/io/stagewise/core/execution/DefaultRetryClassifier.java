package io.stagewise.core.execution;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.OptionalInt;
import java.util.concurrent.TimeoutException;

/// Default failure classification.
///
/// ### Retried
/// - connection failures and timeouts, also when wrapped in an {@link UncheckedIOException}
/// - {@link UpstreamServiceException} without a status, with a 5xx status or with 429
///
/// ### Never retried
/// - programming errors: illegal argument or state, class cast, arithmetic, index or lookup
///   failures, null dereference, unsupported operation, class loading and linkage errors
/// - other I/O errors and {@link FatalNodeException}
/// - {@link UpstreamServiceException} with any other 4xx status
///
/// Everything else is retried.
public class DefaultRetryClassifier implements RetryClassifier {

    private static final List<Class<? extends Throwable>> FATAL =
            List.of(
                    FatalNodeException.class,
                    IllegalArgumentException.class,
                    IllegalStateException.class,
                    ClassCastException.class,
                    ArithmeticException.class,
                    IndexOutOfBoundsException.class,
                    NoSuchElementException.class,
                    NullPointerException.class,
                    UnsupportedOperationException.class,
                    ClassNotFoundException.class,
                    LinkageError.class);

    @Override
    public boolean isRetryable(Throwable error) {
        if (isConnectionFailure(error)) {
            return true;
        }
        if (error instanceof UncheckedIOException unchecked) {
            return isConnectionFailure(unchecked.getCause());
        }
        if (error instanceof UpstreamServiceException upstream) {
            OptionalInt status = upstream.statusCode();
            if (status.isEmpty()) {
                return upstream.getCause() == null || isRetryable(upstream.getCause());
            }
            int code = status.getAsInt();
            return code >= 500 || code == 429;
        }
        if (error instanceof IOException) {
            return false;
        }
        for (Class<? extends Throwable> fatal : FATAL) {
            if (fatal.isInstance(error)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isConnectionFailure(Throwable error) {
        return error instanceof ConnectException
                || error instanceof SocketTimeoutException
                || error instanceof HttpTimeoutException
                || error instanceof TimeoutException;
    }
}
