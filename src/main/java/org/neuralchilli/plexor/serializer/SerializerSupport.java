package org.neuralchilli.plexor.serializer;

import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Shared read/write helpers for the stream serializers.
 * <p>
 * Output must be deterministic: {@code IMap.replace(key, old, new)} compares
 * the serialized form of {@code old} with the stored bytes, so maps are
 * always written in key order.
 */
final class SerializerSupport {

    private static final byte NULL = 0;
    private static final byte STRING = 1;
    private static final byte INT = 2;
    private static final byte LONG = 3;
    private static final byte DOUBLE = 4;
    private static final byte BOOLEAN = 5;
    private static final byte LIST = 6;
    private static final byte MAP = 7;

    private SerializerSupport() {
    }

    static void writeUuid(ObjectDataOutput out, UUID id) throws IOException {
        out.writeLong(id.getMostSignificantBits());
        out.writeLong(id.getLeastSignificantBits());
    }

    static UUID readUuid(ObjectDataInput in) throws IOException {
        long mostSigBits = in.readLong();
        long leastSigBits = in.readLong();
        return new UUID(mostSigBits, leastSigBits);
    }

    static void writeStringOrNull(ObjectDataOutput out, String value) throws IOException {
        if (value == null) {
            out.writeBoolean(false);
        } else {
            out.writeBoolean(true);
            out.writeString(value);
        }
    }

    static String readStringOrNull(ObjectDataInput in) throws IOException {
        boolean hasValue = in.readBoolean();
        return hasValue ? in.readString() : null;
    }

    // Seconds and nanos, so no precision is lost on a round trip
    static void writeInstantOrNull(ObjectDataOutput out, Instant value) throws IOException {
        if (value == null) {
            out.writeBoolean(false);
        } else {
            out.writeBoolean(true);
            out.writeLong(value.getEpochSecond());
            out.writeInt(value.getNano());
        }
    }

    static Instant readInstantOrNull(ObjectDataInput in) throws IOException {
        boolean hasValue = in.readBoolean();
        if (!hasValue) {
            return null;
        }
        long seconds = in.readLong();
        int nanos = in.readInt();
        return Instant.ofEpochSecond(seconds, nanos);
    }

    static void writeStringObjectMap(ObjectDataOutput out, Map<String, Object> map) throws IOException {
        if (map == null) {
            out.writeInt(0);
            return;
        }

        out.writeInt(map.size());
        for (Map.Entry<String, Object> entry : new TreeMap<>(map).entrySet()) {
            out.writeString(entry.getKey());
            writeObject(out, entry.getValue());
        }
    }

    static Map<String, Object> readStringObjectMap(ObjectDataInput in) throws IOException {
        int size = in.readInt();
        if (size == 0) {
            return Map.of();
        }

        Map<String, Object> map = new HashMap<>(size);
        for (int i = 0; i < size; i++) {
            String key = in.readString();
            Object value = readObject(in);
            map.put(key, value);
        }
        return Collections.unmodifiableMap(map);
    }

    @SuppressWarnings("unchecked")
    static void writeObject(ObjectDataOutput out, Object value) throws IOException {
        if (value == null) {
            out.writeByte(NULL);
        } else if (value instanceof String) {
            out.writeByte(STRING);
            out.writeString((String) value);
        } else if (value instanceof Integer) {
            out.writeByte(INT);
            out.writeInt((Integer) value);
        } else if (value instanceof Long) {
            out.writeByte(LONG);
            out.writeLong((Long) value);
        } else if (value instanceof Double) {
            out.writeByte(DOUBLE);
            out.writeDouble((Double) value);
        } else if (value instanceof Boolean) {
            out.writeByte(BOOLEAN);
            out.writeBoolean((Boolean) value);
        } else if (value instanceof List) {
            List<Object> list = (List<Object>) value;
            out.writeByte(LIST);
            out.writeInt(list.size());
            for (Object item : list) {
                writeObject(out, item);
            }
        } else if (value instanceof Map) {
            Map<String, Object> nested = new TreeMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                nested.put(String.valueOf(entry.getKey()), entry.getValue());
            }
            out.writeByte(MAP);
            writeStringObjectMap(out, nested);
        } else {
            // Fallback to string representation
            out.writeByte(STRING);
            out.writeString(value.toString());
        }
    }

    static Object readObject(ObjectDataInput in) throws IOException {
        byte type = in.readByte();
        return switch (type) {
            case NULL -> null;
            case STRING -> in.readString();
            case INT -> in.readInt();
            case LONG -> in.readLong();
            case DOUBLE -> in.readDouble();
            case BOOLEAN -> in.readBoolean();
            case LIST -> readList(in);
            case MAP -> readStringObjectMap(in);
            default -> throw new IOException("Unknown object type: " + type);
        };
    }

    private static List<Object> readList(ObjectDataInput in) throws IOException {
        int size = in.readInt();
        List<Object> list = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            list.add(readObject(in));
        }
        return Collections.unmodifiableList(list);
    }
}
