package sloth.api.impl;

/**
 * Status codes used by the server and their reason phrases.
 */
public final class HttpStatus {

    public static final int OK = 200;
    public static final int CREATED = 201;
    public static final int NO_CONTENT = 204;
    public static final int NOT_MODIFIED = 304;
    public static final int BAD_REQUEST = 400;
    public static final int NOT_FOUND = 404;
    public static final int METHOD_NOT_ALLOWED = 405;
    public static final int PAYLOAD_TOO_LARGE = 413;
    public static final int INTERNAL_SERVER_ERROR = 500;

    private HttpStatus() {}

    /** Maps a status code to its reason phrase; unknown codes map to "Unknown". */
    public static String reason(int code) {
        return switch (code) {
            case 100 -> "Continue";
            case OK -> "OK";
            case CREATED -> "Created";
            case 202 -> "Accepted";
            case NO_CONTENT -> "No Content";
            case 301 -> "Moved Permanently";
            case 302 -> "Found";
            case NOT_MODIFIED -> "Not Modified";
            case BAD_REQUEST -> "Bad Request";
            case 401 -> "Unauthorized";
            case 403 -> "Forbidden";
            case NOT_FOUND -> "Not Found";
            case METHOD_NOT_ALLOWED -> "Method Not Allowed";
            case 409 -> "Conflict";
            case PAYLOAD_TOO_LARGE -> "Payload Too Large";
            case 415 -> "Unsupported Media Type";
            case INTERNAL_SERVER_ERROR -> "Internal Server Error";
            case 501 -> "Not Implemented";
            case 503 -> "Service Unavailable";
            default -> "Unknown";
        };
    }
}
