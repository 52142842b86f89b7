package at.sv.boost.api.hass;

import java.util.Locale;

public final class HassApiUtils {
    private HassApiUtils() {
    }

    /**
     * Returns the websocket origin based on the REST API origin, using wss:// for https:// and ws:// for http://.
     *
     * @param origin the REST api origin to get the websocket origin from
     * @return the origin to be used for a websocket connection.
     */
    public static String getHassWebsocketOrigin(String origin) {
        if (origin.startsWith("https://")) {
            return origin.replaceAll("^https://", "wss://");
        }
        return origin.replaceAll("^http://", "ws://");
    }

    /**
     * @return the part of the entity id after the domain, e.g. {@code living_room} for {@code climate.living_room}
     */
    public static String getObjectId(String entityId) {
        int dot = entityId.indexOf('.');
        return dot < 0 ? entityId : entityId.substring(dot + 1);
    }

    public static String getDomain(String entityId) {
        int dot = entityId.indexOf('.');
        return dot < 0 ? "" : entityId.substring(0, dot);
    }

    /**
     * Derives a display name from the object id: {@code living_room} becomes {@code Living Room}.
     */
    public static String toDisplayName(String entityId) {
        String[] words = getObjectId(entityId).split("_+");
        StringBuilder sb = new StringBuilder();
        for (String word : words) {
            if (word.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(word.substring(0, 1).toUpperCase(Locale.ROOT)).append(word.substring(1));
        }
        return sb.toString();
    }
}
