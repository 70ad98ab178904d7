package com.errorsentinel.engine.classify;

import java.util.List;

public final class NoisePatterns {
    public static final List<String> BUILT_IN = List.of(
            // network / external API
            "SocketTimeoutException",
            "ConnectTimeoutException",
            "HttpHostConnectException",
            "ConnectionRefused",
            "UnknownHostException",
            "NoRouteToHostException",
            "SSLHandshakeException",
            "SocketException",
            // client disconnects
            "ClientAbortException",
            "Broken pipe",
            "Connection reset by peer",
            "EOFException",
            // rate limiting
            "TooManyRequestsException",
            "ThrottlingException",
            "RateLimitException"
    );

    private NoisePatterns() {
    }
}
