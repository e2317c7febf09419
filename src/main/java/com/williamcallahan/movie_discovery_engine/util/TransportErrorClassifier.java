/**
 * Maps HTTP statuses and low-level throwables onto the transport failure taxonomy
 *
 * @author William Callahan
 *
 * Features:
 * - Walks the full cause chain so wrapped Netty and WebClient errors classify correctly
 * - Certificate problems win over every other classification
 * - Produces ready-to-throw TransportException instances
 */

package com.williamcallahan.movie_discovery_engine.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.williamcallahan.movie_discovery_engine.service.transport.TransportException;
import com.williamcallahan.movie_discovery_engine.types.TransportFailure;
import org.springframework.core.codec.DecodingException;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import javax.net.ssl.SSLException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.PortUnreachableException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

public final class TransportErrorClassifier {

    private TransportErrorClassifier() {
        // Utility class
    }

    /**
     * Classify an HTTP status. 2xx and 3xx are not failures.
     *
     * @param statusCode HTTP status
     * @return failure kind, or null for a non-failure status
     */
    public static TransportFailure classifyStatus(int statusCode) {
        if (statusCode == 429) {
            return TransportFailure.RATE_LIMITED;
        }
        if (statusCode >= 500 && statusCode <= 599) {
            return TransportFailure.SERVER_ERROR;
        }
        if (statusCode >= 400 && statusCode <= 499) {
            return TransportFailure.CLIENT_ERROR;
        }
        return null;
    }

    /**
     * Build the exception for a failed HTTP status
     *
     * @param statusCode HTTP status, expected to be 4xx or 5xx
     * @param retryAfter Retry-After hint, may be null
     * @return classified exception
     */
    public static TransportException fromStatus(int statusCode, Duration retryAfter) {
        TransportFailure kind = classifyStatus(statusCode);
        if (kind == TransportFailure.RATE_LIMITED) {
            return TransportException.rateLimited(retryAfter);
        }
        if (kind == TransportFailure.SERVER_ERROR) {
            return TransportException.serverError(statusCode);
        }
        if (kind == TransportFailure.CLIENT_ERROR) {
            return TransportException.clientError(statusCode);
        }
        return new TransportException(TransportFailure.UNKNOWN, "Unexpected HTTP status " + statusCode, statusCode, null, null);
    }

    /**
     * Categorize a throwable into a failure kind
     */
    public static TransportFailure classify(Throwable throwable) {
        if (throwable == null) {
            return TransportFailure.UNKNOWN;
        }
        if (throwable instanceof TransportException te) {
            return te.getKind();
        }
        if (hasCause(throwable, SSLException.class)) {
            return TransportFailure.TRUST_FAILURE;
        }
        for (Throwable current : causeChain(throwable)) {
            if (current instanceof TransportException te) {
                return te.getKind();
            }
            if (current instanceof TimeoutException
                || current instanceof SocketTimeoutException
                || current instanceof io.netty.handler.timeout.TimeoutException
                || current instanceof io.netty.channel.ConnectTimeoutException) {
                return TransportFailure.TIMEOUT;
            }
            if (current instanceof ConnectException
                || current instanceof UnknownHostException
                || current instanceof NoRouteToHostException
                || current instanceof PortUnreachableException) {
                return TransportFailure.NO_CONNECTIVITY;
            }
            if (current instanceof JsonProcessingException || current instanceof DecodingException) {
                return TransportFailure.DECODING_ERROR;
            }
            if (current instanceof CancellationException) {
                return TransportFailure.CANCELLED;
            }
        }
        if (hasCause(throwable, WebClientRequestException.class)) {
            // request never produced a response
            return TransportFailure.NO_CONNECTIVITY;
        }
        return TransportFailure.UNKNOWN;
    }

    /**
     * Wrap any throwable as a TransportException, returning it unchanged when it already is one
     */
    public static TransportException toTransportException(Throwable throwable) {
        if (throwable instanceof TransportException te) {
            return te;
        }
        TransportFailure kind = classify(throwable);
        return switch (kind) {
            case TIMEOUT -> TransportException.timeout(throwable);
            case NO_CONNECTIVITY -> TransportException.noConnectivity(throwable);
            case DECODING_ERROR -> TransportException.decodingError(throwable);
            case TRUST_FAILURE -> TransportException.trustFailure(throwable);
            default -> new TransportException(kind, describe(throwable), throwable);
        };
    }

    private static String describe(Throwable throwable) {
        String message = throwable.getMessage();
        return throwable.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }

    private static boolean hasCause(Throwable throwable, Class<? extends Throwable> type) {
        for (Throwable current : causeChain(throwable)) {
            if (type.isInstance(current)) {
                return true;
            }
        }
        return false;
    }

    private static List<Throwable> causeChain(Throwable throwable) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Throwable> chain = new ArrayList<>();
        Throwable current = throwable;
        while (current != null && seen.add(current)) {
            chain.add(current);
            current = current.getCause();
        }
        return chain;
    }
}
