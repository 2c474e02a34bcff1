package party.iroiro.r2oracle.util;

import org.springframework.r2dbc.core.binding.BindMarkers;
import org.springframework.r2dbc.core.binding.BindMarkersFactory;

/**
 * Rewrites anonymous parameter markers into the markers of a {@link BindMarkersFactory}
 *
 * <p>
 * The scan is naive: markers inside string literals or comments are replaced too.
 * </p>
 */
public class PlaceholderTranslator {
    private final char marker;
    private final BindMarkersFactory markers;

    public PlaceholderTranslator(char marker, BindMarkersFactory markers) {
        this.marker = marker;
        this.markers = markers;
    }

    /**
     * @param sql SQL with anonymous markers
     * @return the rewritten SQL, or {@code sql} itself when it contains no marker
     */
    public String translate(String sql) {
        int first = sql.indexOf(marker);
        if (first < 0) {
            return sql;
        }
        BindMarkers bindMarkers = markers.create();
        StringBuilder builder = new StringBuilder(sql.length() + 16);
        builder.append(sql, 0, first);
        for (int i = first; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (c == marker) {
                builder.append(bindMarkers.next().getPlaceholder());
            } else {
                builder.append(c);
            }
        }
        return builder.toString();
    }
}
