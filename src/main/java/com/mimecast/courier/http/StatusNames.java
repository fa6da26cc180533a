package com.mimecast.courier.http;

import java.util.HashMap;
import java.util.Map;

/**
 * HTTP status code names as rendered in response logs.
 *
 * <p>Well known codes render as a PascalCase name like <i>InternalServerError</i>.
 * <br>Unknown codes render as the number itself.
 */
public class StatusNames {
    private static final Map<Integer, String> NAMES = new HashMap<>();

    static {
        NAMES.put(100, "Continue");
        NAMES.put(101, "SwitchingProtocols");
        NAMES.put(102, "Processing");
        NAMES.put(103, "EarlyHints");
        NAMES.put(200, "OK");
        NAMES.put(201, "Created");
        NAMES.put(202, "Accepted");
        NAMES.put(203, "NonAuthoritativeInformation");
        NAMES.put(204, "NoContent");
        NAMES.put(205, "ResetContent");
        NAMES.put(206, "PartialContent");
        NAMES.put(207, "MultiStatus");
        NAMES.put(208, "AlreadyReported");
        NAMES.put(226, "IMUsed");
        NAMES.put(300, "MultipleChoices");
        NAMES.put(301, "MovedPermanently");
        NAMES.put(302, "Found");
        NAMES.put(303, "SeeOther");
        NAMES.put(304, "NotModified");
        NAMES.put(305, "UseProxy");
        NAMES.put(307, "TemporaryRedirect");
        NAMES.put(308, "PermanentRedirect");
        NAMES.put(400, "BadRequest");
        NAMES.put(401, "Unauthorized");
        NAMES.put(402, "PaymentRequired");
        NAMES.put(403, "Forbidden");
        NAMES.put(404, "NotFound");
        NAMES.put(405, "MethodNotAllowed");
        NAMES.put(406, "NotAcceptable");
        NAMES.put(407, "ProxyAuthenticationRequired");
        NAMES.put(408, "RequestTimeout");
        NAMES.put(409, "Conflict");
        NAMES.put(410, "Gone");
        NAMES.put(411, "LengthRequired");
        NAMES.put(412, "PreconditionFailed");
        NAMES.put(413, "RequestEntityTooLarge");
        NAMES.put(414, "RequestUriTooLong");
        NAMES.put(415, "UnsupportedMediaType");
        NAMES.put(416, "RequestedRangeNotSatisfiable");
        NAMES.put(417, "ExpectationFailed");
        NAMES.put(421, "MisdirectedRequest");
        NAMES.put(422, "UnprocessableEntity");
        NAMES.put(423, "Locked");
        NAMES.put(424, "FailedDependency");
        NAMES.put(426, "UpgradeRequired");
        NAMES.put(428, "PreconditionRequired");
        NAMES.put(429, "TooManyRequests");
        NAMES.put(431, "RequestHeaderFieldsTooLarge");
        NAMES.put(451, "UnavailableForLegalReasons");
        NAMES.put(500, "InternalServerError");
        NAMES.put(501, "NotImplemented");
        NAMES.put(502, "BadGateway");
        NAMES.put(503, "ServiceUnavailable");
        NAMES.put(504, "GatewayTimeout");
        NAMES.put(505, "HttpVersionNotSupported");
        NAMES.put(506, "VariantAlsoNegotiates");
        NAMES.put(507, "InsufficientStorage");
        NAMES.put(508, "LoopDetected");
        NAMES.put(510, "NotExtended");
        NAMES.put(511, "NetworkAuthenticationRequired");
    }

    /**
     * Protected constructor.
     */
    private StatusNames() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Gets status name.
     *
     * @param code Status code.
     * @return Name string.
     */
    public static String get(int code) {
        return NAMES.getOrDefault(code, String.valueOf(code));
    }
}
