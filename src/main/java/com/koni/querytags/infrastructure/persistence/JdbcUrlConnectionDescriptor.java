package com.koni.querytags.infrastructure.persistence;

import com.koni.querytags.application.port.ConnectionDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Connection descriptor derived from the configured JDBC URL.
 *
 * Supported shapes:
 * - network URLs: {@code jdbc:postgresql://db1:5432/app?unixSocketPath=/tmp/.s.PGSQL.5432}
 * - host-less URLs naming only the database: {@code jdbc:postgresql:app}
 * - SQL Server: {@code jdbc:sqlserver://db1:1433;databaseName=app}
 * - Oracle thin: {@code jdbc:oracle:thin:@db1:1521:APP} and {@code jdbc:oracle:thin:@//db1:1521/app}
 * - embedded: {@code jdbc:h2:mem:app}, {@code jdbc:h2:file:/data/app}, {@code jdbc:sqlite:/data/app.db}
 *
 * The URL is parsed once; nothing here touches a live connection.
 */
@Slf4j
public class JdbcUrlConnectionDescriptor implements ConnectionDescriptor {

    private static final Pattern NETWORK_URL =
            Pattern.compile("^jdbc:[^/]*?//([^/?;]*)(?:/([^?;]*))?(?:[?;](.*))?$");

    private static final Pattern LOCAL_URL =
            Pattern.compile("^jdbc:[A-Za-z0-9]+:([^/:?;@]+)(?:[?;](.*))?$");

    private static final List<String> SOCKET_PARAMETERS = List.of("socket", "unixSocketPath", "localSocket");
    private static final List<String> DATABASE_PARAMETERS = List.of("databaseName", "database");

    private final String host;
    private final String database;
    private final String socket;

    public JdbcUrlConnectionDescriptor(String host, String database, String socket) {
        this.host = emptyToNull(host);
        this.database = emptyToNull(database);
        this.socket = emptyToNull(socket);
    }

    /**
     * Parses a JDBC URL.
     *
     * @param jdbcUrl the URL, may be blank
     * @param socketOverride socket to report instead of the one found in the URL, may be blank
     * @return the descriptor; its parts are empty when the URL does not carry them
     */
    public static JdbcUrlConnectionDescriptor parse(String jdbcUrl, String socketOverride) {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            return new JdbcUrlConnectionDescriptor(null, null, socketOverride);
        }
        String url = jdbcUrl.trim();
        JdbcUrlConnectionDescriptor parsed;
        if (url.startsWith("jdbc:oracle:")) {
            parsed = parseOracle(url);
        } else if (url.startsWith("jdbc:h2:") && !url.contains("//")) {
            parsed = parseEmbedded(url.substring("jdbc:h2:".length()));
        } else if (url.startsWith("jdbc:sqlite:")) {
            parsed = parseEmbedded(url.substring("jdbc:sqlite:".length()));
        } else {
            parsed = parseNetwork(url);
        }
        if (socketOverride != null && !socketOverride.isBlank()) {
            return new JdbcUrlConnectionDescriptor(parsed.host, parsed.database, socketOverride);
        }
        log.debug("Parsed connection descriptor from JDBC URL: host={}, database={}, socket={}",
                parsed.host, parsed.database, parsed.socket);
        return parsed;
    }

    @Override
    public Optional<String> host() {
        return Optional.ofNullable(host);
    }

    @Override
    public Optional<String> database() {
        return Optional.ofNullable(database);
    }

    @Override
    public Optional<String> socket() {
        return Optional.ofNullable(socket);
    }

    private static JdbcUrlConnectionDescriptor parseNetwork(String url) {
        Matcher matcher = NETWORK_URL.matcher(url);
        if (!matcher.matches()) {
            return parseLocal(url);
        }
        Map<String, String> parameters = parameters(matcher.group(3));
        String database = matcher.group(2);
        if (database == null || database.isEmpty()) {
            database = firstParameter(parameters, DATABASE_PARAMETERS);
        }
        return new JdbcUrlConnectionDescriptor(
                hostOf(matcher.group(1)),
                database,
                firstParameter(parameters, SOCKET_PARAMETERS));
    }

    private static JdbcUrlConnectionDescriptor parseLocal(String url) {
        Matcher matcher = LOCAL_URL.matcher(url);
        if (!matcher.matches()) {
            log.warn("Unrecognized JDBC URL, database components will be empty: {}", url);
            return new JdbcUrlConnectionDescriptor(null, null, null);
        }
        Map<String, String> parameters = parameters(matcher.group(2));
        return new JdbcUrlConnectionDescriptor(
                null,
                matcher.group(1),
                firstParameter(parameters, SOCKET_PARAMETERS));
    }

    private static JdbcUrlConnectionDescriptor parseEmbedded(String location) {
        String path = location;
        int end = indexOfAny(path, ';', '?');
        if (end >= 0) {
            path = path.substring(0, end);
        }
        if (path.startsWith("mem:")) {
            path = path.substring("mem:".length());
        } else if (path.startsWith("file:")) {
            path = path.substring("file:".length());
        }
        return new JdbcUrlConnectionDescriptor(null, path, null);
    }

    private static JdbcUrlConnectionDescriptor parseOracle(String url) {
        int at = url.indexOf('@');
        if (at < 0) {
            return new JdbcUrlConnectionDescriptor(null, null, null);
        }
        String target = url.substring(at + 1);
        if (target.startsWith("//")) {
            return parseNetwork("jdbc:oracle:" + target);
        }
        String[] parts = target.split(":");
        String database = parts.length >= 3 ? parts[2] : null;
        return new JdbcUrlConnectionDescriptor(parts[0], database, null);
    }

    /**
     * First host of the authority, without user info or port.
     */
    static String hostOf(String authority) {
        if (authority == null || authority.isEmpty()) {
            return null;
        }
        String host = authority;
        int at = host.lastIndexOf('@');
        if (at >= 0) {
            host = host.substring(at + 1);
        }
        int comma = host.indexOf(',');
        if (comma >= 0) {
            host = host.substring(0, comma);
        }
        if (host.startsWith("[")) {
            int close = host.indexOf(']');
            return close > 0 ? host.substring(1, close) : host;
        }
        int colon = host.indexOf(':');
        return colon >= 0 ? host.substring(0, colon) : host;
    }

    private static Map<String, String> parameters(String query) {
        Map<String, String> parameters = new LinkedHashMap<>();
        if (query == null || query.isEmpty()) {
            return parameters;
        }
        for (String pair : query.split("[&;]")) {
            int eq = pair.indexOf('=');
            if (eq > 0) {
                parameters.put(pair.substring(0, eq), pair.substring(eq + 1));
            }
        }
        return parameters;
    }

    private static String firstParameter(Map<String, String> parameters, List<String> names) {
        return names.stream()
                .map(parameters::get)
                .filter(value -> value != null && !value.isEmpty())
                .findFirst()
                .orElse(null);
    }

    private static int indexOfAny(String value, char first, char second) {
        int a = value.indexOf(first);
        int b = value.indexOf(second);
        if (a < 0) {
            return b;
        }
        return b < 0 ? a : Math.min(a, b);
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
