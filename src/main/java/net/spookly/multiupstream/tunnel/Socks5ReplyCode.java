package net.spookly.multiupstream.tunnel;

/**
 * SOCKS5 CONNECT reply codes (RFC 1928, section 6).
 */
public enum Socks5ReplyCode {
    SUCCEEDED(0x00, "Succeeded"),
    GENERAL_FAILURE(0x01, "General failure"),
    CONNECTION_NOT_ALLOWED(0x02, "Connection not allowed"),
    NETWORK_UNREACHABLE(0x03, "Network unreachable"),
    HOST_UNREACHABLE(0x04, "Host unreachable"),
    CONNECTION_REFUSED(0x05, "Connection refused"),
    TTL_EXPIRED(0x06, "TTL expired"),
    COMMAND_NOT_SUPPORTED(0x07, "Command not supported"),
    ADDRESS_TYPE_NOT_SUPPORTED(0x08, "Address type not supported");

    private final int code;
    private final String description;

    Socks5ReplyCode(int code, String description) {
        this.code = code;
        this.description = description;
    }

    public int code() {
        return code;
    }

    public String description() {
        return description;
    }

    public static Socks5ReplyCode fromCode(int code) {
        for (Socks5ReplyCode reply : values()) {
            if (reply.code == code) {
                return reply;
            }
        }
        return null;
    }

    /**
     * Human-readable text for a reply code, including codes outside the table.
     */
    public static String describe(int code) {
        Socks5ReplyCode reply = fromCode(code);
        if (reply == null) {
            return "Unknown error code: " + code;
        }
        return reply.description;
    }
}
