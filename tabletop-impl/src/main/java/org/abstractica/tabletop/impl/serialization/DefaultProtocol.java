package org.abstractica.tabletop.impl.serialization;

import org.abstractica.tabletop.Protocol;
import org.abstractica.tabletop.protocol.Command;
import org.abstractica.tabletop.protocol.ServerMessage;

import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashMap;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static org.abstractica.tabletop.impl.serialization.MessageCodec.getRawType;
import static org.abstractica.tabletop.impl.serialization.MessageCodec.getTypeArgument;

/**
 * Default implementation of the Protocol interface.
 *
 * <p>Scans the sealed command and server message hierarchies to assign type
 * ids and compute the protocol hash. Commands get ids 0x0000-0x7FFF, server
 * messages 0x8000-0xFFFF.</p>
 *
 * <p>The hash covers every record reachable from either hierarchy: names,
 * component names and types, enum constants and sealed variant order. Any
 * schema change that alters the wire format changes the hash.</p>
 */
public final class DefaultProtocol implements Protocol
{
    private final String hash;
    private final Map<Class<?>, Integer> typeToId;
    private final Map<Integer, Class<? extends Record>> idToType;

    private DefaultProtocol(
            String hash,
            Map<Class<?>, Integer> typeToId,
            Map<Integer, Class<? extends Record>> idToType
    )
    {
        this.hash = hash;
        this.typeToId = Map.copyOf(typeToId);
        this.idToType = Map.copyOf(idToType);
    }

    /**
     * Creates the protocol for {@link Command} and {@link ServerMessage}.
     *
     * @return the tabletop protocol
     */
    public static DefaultProtocol tabletop()
    {
        return new Builder()
                .clientMessages(Command.class)
                .serverMessages(ServerMessage.class)
                .build();
    }

    @Override
    public String getHash()
    {
        return hash;
    }

    /**
     * Returns the protocol hash as raw bytes.
     *
     * @return 32-byte hash
     */
    public byte[] getHashBytes()
    {
        return HexFormat.of().parseHex(hash);
    }

    /**
     * Gets the type ID for a message class.
     *
     * @param messageClass the message class
     * @return the type ID
     * @throws IllegalArgumentException if the class is not registered
     */
    public int getTypeId(Class<?> messageClass)
    {
        Integer id = typeToId.get(messageClass);
        if (id == null)
        {
            throw new IllegalArgumentException("Unknown message type: " + messageClass.getName());
        }
        return id;
    }

    /**
     * Checks if a type ID is a client message.
     *
     * @param typeId the type ID
     * @return true if client message (0x0000-0x7FFF)
     */
    public boolean isClientMessage(int typeId)
    {
        return (typeId & 0x8000) == 0;
    }

    /**
     * Encodes a message to bytes (type ID + payload).
     *
     * @param message the message record
     * @return encoded bytes
     */
    public byte[] encodeMessage(Record message)
    {
        int typeId = getTypeId(message.getClass());
        byte[] payload = MessageCodec.encode(message);

        ByteBuffer buffer = ByteBuffer.allocate(2 + payload.length);
        buffer.putShort((short) typeId);
        buffer.put(payload);
        return buffer.array();
    }

    /**
     * Decodes a message from bytes.
     *
     * @param data the encoded bytes (type ID + payload)
     * @return decoded message record
     * @throws CodecException if the type id is unknown or the payload is malformed
     */
    public Record decodeMessage(byte[] data)
    {
        int typeId = peekTypeId(data);
        Class<? extends Record> clazz = idToType.get(typeId);
        if (clazz == null)
        {
            throw new CodecException("Unknown type ID: 0x" + Integer.toHexString(typeId));
        }
        byte[] payload = new byte[data.length - 2];
        System.arraycopy(data, 2, payload, 0, payload.length);
        return MessageCodec.decode(payload, clazz);
    }

    /**
     * Decodes a command sent by a client.
     *
     * @param data the encoded bytes (type ID + payload)
     * @return the command
     * @throws CodecException if the data is not a well-formed command
     */
    public Command decodeCommand(byte[] data)
    {
        int typeId = peekTypeId(data);
        if (!isClientMessage(typeId))
        {
            throw new CodecException("Expected command (0x0000-0x7FFF), got type ID: 0x" + Integer.toHexString(typeId));
        }
        return (Command) decodeMessage(data);
    }

    /**
     * Decodes a reply or event sent by the server.
     *
     * @param data the encoded bytes (type ID + payload)
     * @return the server message
     * @throws CodecException if the data is not a well-formed server message
     */
    public ServerMessage decodeServerMessage(byte[] data)
    {
        int typeId = peekTypeId(data);
        if (isClientMessage(typeId))
        {
            throw new CodecException("Expected server message (0x8000-0xFFFF), got type ID: 0x" + Integer.toHexString(typeId));
        }
        return (ServerMessage) decodeMessage(data);
    }

    /**
     * Peeks at the type ID without fully decoding the message.
     *
     * @param data the encoded message bytes
     * @return the type ID
     * @throws CodecException if the data is shorter than a type ID
     */
    public int peekTypeId(byte[] data)
    {
        if (data.length < 2)
        {
            throw new CodecException("Data too short to contain type ID");
        }
        return ((data[0] & 0xFF) << 8) | (data[1] & 0xFF);
    }

    // ========== Builder ==========

    /**
     * Builder for constructing a DefaultProtocol.
     */
    public static class Builder
    {
        private Class<?> clientMessageType;
        private Class<?> serverMessageType;

        public Builder clientMessages(Class<?> sealedInterface)
        {
            this.clientMessageType = Objects.requireNonNull(sealedInterface, "sealedInterface");
            return this;
        }

        public Builder serverMessages(Class<?> sealedInterface)
        {
            this.serverMessageType = Objects.requireNonNull(sealedInterface, "sealedInterface");
            return this;
        }

        public DefaultProtocol build()
        {
            if (clientMessageType == null)
            {
                throw new IllegalStateException("Client message type not set");
            }
            if (serverMessageType == null)
            {
                throw new IllegalStateException("Server message type not set");
            }

            validateSealedInterface(clientMessageType);
            validateSealedInterface(serverMessageType);

            List<Class<? extends Record>> clientTypes = MessageCodec.variantsOf(clientMessageType);
            List<Class<? extends Record>> serverTypes = MessageCodec.variantsOf(serverMessageType);
            for (Class<? extends Record> type : clientTypes)
            {
                validateRecordType(type, new HashSet<>());
            }
            for (Class<? extends Record> type : serverTypes)
            {
                validateRecordType(type, new HashSet<>());
            }

            Map<Class<?>, Integer> typeToId = new HashMap<>();
            Map<Integer, Class<? extends Record>> idToType = new HashMap<>();

            // Client IDs (0x0000 - 0x7FFF)
            int clientId = 0;
            for (Class<? extends Record> type : clientTypes)
            {
                if (clientId > 0x7FFF)
                {
                    throw new IllegalArgumentException("Too many client message types (max 32768)");
                }
                typeToId.put(type, clientId);
                idToType.put(clientId, type);
                clientId++;
            }

            // Server IDs (0x8000 - 0xFFFF)
            int serverId = 0x8000;
            for (Class<? extends Record> type : serverTypes)
            {
                if (serverId > 0xFFFF)
                {
                    throw new IllegalArgumentException("Too many server message types (max 32768)");
                }
                typeToId.put(type, serverId);
                idToType.put(serverId, type);
                serverId++;
            }

            String hash = computeHash(clientTypes, serverTypes);

            return new DefaultProtocol(hash, typeToId, idToType);
        }

        private void validateSealedInterface(Class<?> clazz)
        {
            if (!clazz.isSealed())
            {
                throw new IllegalArgumentException("Not a sealed interface: " + clazz.getName());
            }
            if (!clazz.isInterface())
            {
                throw new IllegalArgumentException("Not an interface: " + clazz.getName());
            }
        }

        private void validateRecordType(Class<? extends Record> recordClass, Set<Class<?>> visiting)
        {
            if (!visiting.add(recordClass))
            {
                throw new IllegalArgumentException("Recursive record type: " + recordClass.getName());
            }
            for (RecordComponent component : recordClass.getRecordComponents())
            {
                validateComponentType(component.getGenericType(),
                        recordClass.getName() + "." + component.getName(), visiting);
            }
            visiting.remove(recordClass);
        }

        @SuppressWarnings("unchecked")
        private void validateComponentType(Type type, String context, Set<Class<?>> visiting)
        {
            Class<?> rawType = getRawType(type);

            if (rawType.isPrimitive()) return;
            if (rawType == Byte.class || rawType == Short.class || rawType == Integer.class ||
                    rawType == Long.class || rawType == Float.class || rawType == Double.class ||
                    rawType == Boolean.class || rawType == Character.class) return;

            if (rawType == String.class || rawType == byte[].class) return;

            if (rawType.isEnum()) return;

            if (rawType.isRecord())
            {
                validateRecordType((Class<? extends Record>) rawType, visiting);
                return;
            }

            if (rawType.isSealed() && rawType.isInterface())
            {
                for (Class<? extends Record> variant : MessageCodec.variantsOf(rawType))
                {
                    validateRecordType(variant, visiting);
                }
                return;
            }

            if (rawType == List.class)
            {
                validateComponentType(getTypeArgument(type, 0), context + " (list element)", visiting);
                return;
            }

            if (rawType == Optional.class)
            {
                validateComponentType(getTypeArgument(type, 0), context + " (optional element)", visiting);
                return;
            }

            throw new IllegalArgumentException("Unsupported type in " + context + ": " + rawType.getName());
        }

        private String computeHash(List<Class<? extends Record>> clientTypes, List<Class<? extends Record>> serverTypes)
        {
            try
            {
                MessageDigest digest = MessageDigest.getInstance("SHA-256");
                Set<Class<?>> described = new HashSet<>();

                for (Class<? extends Record> type : clientTypes)
                {
                    appendTypeToDigest(digest, type, described);
                }
                for (Class<? extends Record> type : serverTypes)
                {
                    appendTypeToDigest(digest, type, described);
                }

                return HexFormat.of().formatHex(digest.digest());
            }
            catch (NoSuchAlgorithmException e)
            {
                throw new RuntimeException("SHA-256 not available", e);
            }
        }

        private void appendTypeToDigest(MessageDigest digest, Class<?> type, Set<Class<?>> described)
        {
            digest.update(type.getName().getBytes(StandardCharsets.UTF_8));
            if (!described.add(type))
            {
                return;
            }

            if (type.isEnum())
            {
                for (Object constant : type.getEnumConstants())
                {
                    digest.update(((Enum<?>) constant).name().getBytes(StandardCharsets.UTF_8));
                }
                return;
            }

            if (type.isSealed())
            {
                for (Class<? extends Record> variant : MessageCodec.variantsOf(type))
                {
                    appendTypeToDigest(digest, variant, described);
                }
                return;
            }

            for (RecordComponent component : type.getRecordComponents())
            {
                digest.update(component.getName().getBytes(StandardCharsets.UTF_8));
                digest.update(getTypeDescriptor(component.getGenericType()).getBytes(StandardCharsets.UTF_8));
                appendNestedTypes(digest, component.getGenericType(), described);
            }
        }

        private void appendNestedTypes(MessageDigest digest, Type type, Set<Class<?>> described)
        {
            Class<?> rawType = getRawType(type);
            if (rawType == List.class || rawType == Optional.class)
            {
                appendNestedTypes(digest, getTypeArgument(type, 0), described);
            }
            else if (rawType.isEnum() || rawType.isRecord() || (rawType.isSealed() && rawType.isInterface()))
            {
                appendTypeToDigest(digest, rawType, described);
            }
        }

        private String getTypeDescriptor(Type type)
        {
            Class<?> rawType = getRawType(type);

            if (rawType == byte.class || rawType == Byte.class) return "B";
            if (rawType == short.class || rawType == Short.class) return "S";
            if (rawType == int.class || rawType == Integer.class) return "I";
            if (rawType == long.class || rawType == Long.class) return "J";
            if (rawType == float.class || rawType == Float.class) return "F";
            if (rawType == double.class || rawType == Double.class) return "D";
            if (rawType == boolean.class || rawType == Boolean.class) return "Z";
            if (rawType == char.class || rawType == Character.class) return "C";

            if (rawType == String.class) return "Ljava/lang/String;";

            if (rawType == byte[].class) return "[B";

            if (rawType == List.class)
            {
                return "Ljava/util/List<" + getTypeDescriptor(getTypeArgument(type, 0)) + ">;";
            }

            if (rawType == Optional.class)
            {
                return "Ljava/util/Optional<" + getTypeDescriptor(getTypeArgument(type, 0)) + ">;";
            }

            if (rawType.isEnum() || rawType.isRecord() || rawType.isSealed())
            {
                return "L" + rawType.getName().replace('.', '/') + ";";
            }

            throw new IllegalArgumentException("Unsupported type: " + rawType.getName());
        }
    }
}
