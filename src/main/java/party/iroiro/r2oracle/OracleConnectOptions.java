package party.iroiro.r2oracle;

import io.r2dbc.spi.ConnectionFactoryOptions;
import io.r2dbc.spi.Option;
import reactor.util.annotation.Nullable;

import java.util.Properties;

/**
 * Immutable options for {@link OracleConnection#establish(OracleConnectOptions)}
 */
public final class OracleConnectOptions {
    public static final int DEFAULT_PORT = 1521;
    public static final String JDBC_PREFIX = "jdbc:oracle:thin:@";

    /**
     * A full JDBC url, used as is instead of the one built from the connect string
     */
    public static final Option<String> URL = Option.valueOf("url");
    /**
     * Class name of a custom {@link party.iroiro.r2oracle.codecs.Codec}
     */
    public static final Option<String> CODEC = Option.valueOf("codec");

    private final String username;
    private final String password;
    private final String connectString;
    @Nullable
    private final String url;
    @Nullable
    private final String codec;

    public OracleConnectOptions(String username, String password, String connectString) {
        this(username, password, connectString, null, null);
    }

    private OracleConnectOptions(String username, String password, String connectString,
                                 @Nullable String url, @Nullable String codec) {
        this.username = username;
        this.password = password;
        this.connectString = connectString;
        this.url = url;
        this.codec = codec;
    }

    /**
     * Reads options from R2DBC style {@link ConnectionFactoryOptions}
     *
     * <p>
     * The connect string is {@code //host:port/service}, or {@code //host:port} when no
     * service is given. With {@link #URL} present, host and port become optional.
     * </p>
     *
     * @param options the options
     * @return connect options
     * @throws ConnectionException if required parts are missing
     */
    public static OracleConnectOptions from(ConnectionFactoryOptions options) {
        String user = stringOf(options, ConnectionFactoryOptions.USER);
        String password = stringOf(options, ConnectionFactoryOptions.PASSWORD);
        String url = stringOf(options, URL);
        String codec = stringOf(options, CODEC);
        String host = stringOf(options, ConnectionFactoryOptions.HOST);

        String connectString = "";
        if (host != null) {
            Object port = options.getValue(ConnectionFactoryOptions.PORT);
            String service = stringOf(options, ConnectionFactoryOptions.DATABASE);
            connectString = connectString(host, port == null ? DEFAULT_PORT : Integer.parseInt(port.toString()), service);
        } else if (url == null) {
            throw new ConnectionException("Host is required");
        }
        return new OracleConnectOptions(user == null ? "" : user, password == null ? "" : password,
                connectString, url, codec);
    }

    static String connectString(String host, int port, @Nullable String service) {
        String trimmed = service == null ? "" : service.replaceFirst("^/+", "");
        if (trimmed.isEmpty()) {
            return "//" + host + ":" + port;
        } else {
            return "//" + host + ":" + port + "/" + trimmed;
        }
    }

    @Nullable
    private static String stringOf(ConnectionFactoryOptions options, Option<?> option) {
        Object value = options.getValue(option);
        return value == null ? null : value.toString();
    }

    public OracleConnectOptions withUrl(String url) {
        return new OracleConnectOptions(username, password, connectString, url, codec);
    }

    public OracleConnectOptions withCodec(String codec) {
        return new OracleConnectOptions(username, password, connectString, url, codec);
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public String getConnectString() {
        return connectString;
    }

    @Nullable
    public String getCodec() {
        return codec;
    }

    public String getJdbcUrl() {
        return url == null ? JDBC_PREFIX + connectString : url;
    }

    public Properties getProperties() {
        Properties properties = new Properties();
        if (!username.isEmpty()) {
            properties.put("user", username);
        }
        if (!password.isEmpty()) {
            properties.put("password", password);
        }
        return properties;
    }

    @Override
    public String toString() {
        return "OracleConnectOptions{username=" + username + ", url=" + getJdbcUrl() + "}";
    }
}
