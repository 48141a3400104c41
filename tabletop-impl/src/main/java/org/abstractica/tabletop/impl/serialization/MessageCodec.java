package org.abstractica.tabletop.impl.serialization;

import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Encodes and decodes Java records to/from wire format.
 *
 * <p>Supports:</p>
 * <ul>
 *   <li>Primitives: byte, short, int, long, float, double, boolean, char</li>
 *   <li>String: 2-byte length + UTF-8 bytes</li>
 *   <li>byte[]: 4-byte length + raw bytes</li>
 *   <li>List&lt;T&gt;: 2-byte count + serialized elements</li>
 *   <li>Optional&lt;T&gt;: 1-byte presence + value if present</li>
 *   <li>Enum: 2-byte ordinal</li>
 *   <li>Nested records: serialized fields concatenated</li>
 *   <li>Sealed interfaces of records: 2-byte variant index + the variant's fields</li>
 * </ul>
 *
 * <p>Variant indices follow the permitted records of the sealed interface,
 * collected recursively and sorted by fully-qualified name.</p>
 *
 * <p>Decoding never trusts the input: truncated data, bad lengths, invalid
 * UTF-8, unknown ordinals and trailing bytes raise {@link CodecException}.</p>
 */
public final class MessageCodec
{
    private MessageCodec() {}

    /**
     * Maximum string length in bytes (2-byte length field).
     */
    public static final int MAX_STRING_LENGTH = 65535;

    /**
     * Maximum list size (2-byte count field).
     */
    public static final int MAX_LIST_SIZE = 65535;

    private static final Map<Class<?>, RecordLayout> LAYOUTS = new ConcurrentHashMap<>();
    private static final Map<Class<?>, List<Class<? extends Record>>> VARIANTS = new ConcurrentHashMap<>();

    // ========== Encoding ==========

    /**
     * Encodes a record to bytes.
     *
     * @param record the record to encode
     * @return encoded bytes
     */
    public static byte[] encode(Record record)
    {
        Objects.requireNonNull(record, "record");

        ByteBuffer buffer = ByteBuffer.allocate(calculateSize(record));
        encodeRecord(buffer, record);
        return buffer.array();
    }

    /**
     * Encodes a record into a ByteBuffer.
     *
     * @param buffer the buffer to write to
     * @param record the record to encode
     */
    public static void encodeRecord(ByteBuffer buffer, Record record)
    {
        RecordLayout layout = layoutOf(record.getClass());
        for (int i = 0; i < layout.components().length; i++)
        {
            encodeValue(buffer, layout.read(record, i), layout.components()[i].getGenericType());
        }
    }

    private static void encodeValue(ByteBuffer buffer, Object value, Type type)
    {
        Class<?> rawType = getRawType(type);

        // Primitives
        if (rawType == byte.class || rawType == Byte.class)
        {
            buffer.put((Byte) value);
        }
        else if (rawType == short.class || rawType == Short.class)
        {
            buffer.putShort((Short) value);
        }
        else if (rawType == int.class || rawType == Integer.class)
        {
            buffer.putInt((Integer) value);
        }
        else if (rawType == long.class || rawType == Long.class)
        {
            buffer.putLong((Long) value);
        }
        else if (rawType == float.class || rawType == Float.class)
        {
            buffer.putFloat((Float) value);
        }
        else if (rawType == double.class || rawType == Double.class)
        {
            buffer.putDouble((Double) value);
        }
        else if (rawType == boolean.class || rawType == Boolean.class)
        {
            buffer.put((byte) ((Boolean) value ? 1 : 0));
        }
        else if (rawType == char.class || rawType == Character.class)
        {
            buffer.putChar((Character) value);
        }
        else if (rawType == String.class)
        {
            encodeString(buffer, (String) value);
        }
        else if (rawType == byte[].class)
        {
            byte[] bytes = (byte[]) value;
            buffer.putInt(bytes.length);
            buffer.put(bytes);
        }
        else if (rawType == List.class)
        {
            encodeList(buffer, (List<?>) value, getTypeArgument(type, 0));
        }
        else if (rawType == Optional.class)
        {
            encodeOptional(buffer, (Optional<?>) value, getTypeArgument(type, 0));
        }
        else if (rawType.isEnum())
        {
            buffer.putShort((short) ((Enum<?>) value).ordinal());
        }
        else if (rawType.isRecord())
        {
            encodeRecord(buffer, (Record) value);
        }
        else if (rawType.isSealed())
        {
            buffer.putShort((short) variantIndex(rawType, value.getClass()));
            encodeRecord(buffer, (Record) value);
        }
        else
        {
            throw new IllegalArgumentException("Unsupported type: " + rawType.getName());
        }
    }

    private static void encodeString(ByteBuffer buffer, String value)
    {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > MAX_STRING_LENGTH)
        {
            throw new IllegalArgumentException("String too long: " + bytes.length + " bytes (max " + MAX_STRING_LENGTH + ")");
        }
        buffer.putShort((short) bytes.length);
        buffer.put(bytes);
    }

    private static void encodeList(ByteBuffer buffer, List<?> list, Type elementType)
    {
        if (list.size() > MAX_LIST_SIZE)
        {
            throw new IllegalArgumentException("List too large: " + list.size() + " elements (max " + MAX_LIST_SIZE + ")");
        }
        buffer.putShort((short) list.size());
        for (Object element : list)
        {
            encodeValue(buffer, element, elementType);
        }
    }

    private static void encodeOptional(ByteBuffer buffer, Optional<?> optional, Type elementType)
    {
        if (optional.isPresent())
        {
            buffer.put((byte) 1);
            encodeValue(buffer, optional.get(), elementType);
        }
        else
        {
            buffer.put((byte) 0);
        }
    }

    // ========== Decoding ==========

    /**
     * Decodes bytes to a record.
     *
     * @param data  the bytes to decode
     * @param clazz the record class
     * @param <T>   the record type
     * @return decoded record
     * @throws CodecException if the bytes are not a valid encoding of {@code clazz}
     */
    public static <T extends Record> T decode(byte[] data, Class<T> clazz)
    {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(clazz, "clazz");

        ByteBuffer buffer = ByteBuffer.wrap(data);
        T record = decodeRecord(buffer, clazz);
        if (buffer.hasRemaining())
        {
            throw new CodecException(buffer.remaining() + " trailing bytes after " + clazz.getSimpleName());
        }
        return record;
    }

    /**
     * Decodes a record from a ByteBuffer.
     *
     * @param buffer the buffer to read from
     * @param clazz  the record class
     * @param <T>    the record type
     * @return decoded record
     * @throws CodecException if the buffer does not hold a valid encoding
     */
    public static <T extends Record> T decodeRecord(ByteBuffer buffer, Class<T> clazz)
    {
        RecordLayout layout = layoutOf(clazz);
        RecordComponent[] components = layout.components();
        Object[] args = new Object[components.length];

        try
        {
            for (int i = 0; i < components.length; i++)
            {
                args[i] = decodeValue(buffer, components[i].getGenericType());
            }
        }
        catch (BufferUnderflowException e)
        {
            throw new CodecException("Truncated " + clazz.getSimpleName());
        }

        return clazz.cast(layout.construct(args));
    }

    @SuppressWarnings("unchecked")
    private static Object decodeValue(ByteBuffer buffer, Type type)
    {
        Class<?> rawType = getRawType(type);

        if (rawType == byte.class || rawType == Byte.class)
        {
            return buffer.get();
        }
        else if (rawType == short.class || rawType == Short.class)
        {
            return buffer.getShort();
        }
        else if (rawType == int.class || rawType == Integer.class)
        {
            return buffer.getInt();
        }
        else if (rawType == long.class || rawType == Long.class)
        {
            return buffer.getLong();
        }
        else if (rawType == float.class || rawType == Float.class)
        {
            return buffer.getFloat();
        }
        else if (rawType == double.class || rawType == Double.class)
        {
            return buffer.getDouble();
        }
        else if (rawType == boolean.class || rawType == Boolean.class)
        {
            byte flag = buffer.get();
            if (flag != 0 && flag != 1)
            {
                throw new CodecException("Invalid boolean byte: " + flag);
            }
            return flag == 1;
        }
        else if (rawType == char.class || rawType == Character.class)
        {
            return buffer.getChar();
        }
        else if (rawType == String.class)
        {
            return decodeString(buffer);
        }
        else if (rawType == byte[].class)
        {
            int length = buffer.getInt();
            if (length < 0 || length > buffer.remaining())
            {
                throw new CodecException("Invalid byte array length: " + length);
            }
            byte[] bytes = new byte[length];
            buffer.get(bytes);
            return bytes;
        }
        else if (rawType == List.class)
        {
            return decodeList(buffer, getTypeArgument(type, 0));
        }
        else if (rawType == Optional.class)
        {
            return decodeOptional(buffer, getTypeArgument(type, 0));
        }
        else if (rawType.isEnum())
        {
            int ordinal = buffer.getShort() & 0xFFFF;
            Object[] constants = rawType.getEnumConstants();
            if (ordinal >= constants.length)
            {
                throw new CodecException("Invalid enum ordinal: " + ordinal + " for " + rawType.getName());
            }
            return constants[ordinal];
        }
        else if (rawType.isRecord())
        {
            return decodeRecord(buffer, (Class<? extends Record>) rawType);
        }
        else if (rawType.isSealed())
        {
            int index = buffer.getShort() & 0xFFFF;
            List<Class<? extends Record>> variants = variantsOf(rawType);
            if (index >= variants.size())
            {
                throw new CodecException("Invalid variant index: " + index + " for " + rawType.getName());
            }
            return decodeRecord(buffer, variants.get(index));
        }
        else
        {
            throw new IllegalArgumentException("Unsupported type: " + rawType.getName());
        }
    }

    private static String decodeString(ByteBuffer buffer)
    {
        int length = buffer.getShort() & 0xFFFF;
        if (length > buffer.remaining())
        {
            throw new CodecException("String length " + length + " exceeds remaining " + buffer.remaining());
        }
        ByteBuffer slice = buffer.slice();
        slice.limit(length);
        buffer.position(buffer.position() + length);
        try
        {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(slice)
                    .toString();
        }
        catch (CharacterCodingException e)
        {
            throw new CodecException("Invalid UTF-8 in string field");
        }
    }

    private static List<?> decodeList(ByteBuffer buffer, Type elementType)
    {
        int count = buffer.getShort() & 0xFFFF;
        // every element takes at least one byte unless it is an empty record
        if (count > buffer.remaining() && !isEmptyRecord(elementType))
        {
            throw new CodecException("List count " + count + " exceeds remaining " + buffer.remaining());
        }
        List<Object> list = new ArrayList<>(count);
        for (int i = 0; i < count; i++)
        {
            list.add(decodeValue(buffer, elementType));
        }
        return list;
    }

    private static Optional<?> decodeOptional(ByteBuffer buffer, Type elementType)
    {
        byte present = buffer.get();
        if (present == 0)
        {
            return Optional.empty();
        }
        if (present != 1)
        {
            throw new CodecException("Invalid optional presence byte: " + present);
        }
        return Optional.of(decodeValue(buffer, elementType));
    }

    private static boolean isEmptyRecord(Type type)
    {
        Class<?> rawType = getRawType(type);
        return rawType.isRecord() && rawType.getRecordComponents().length == 0;
    }

    // ========== Size calculation ==========

    /**
     * Calculates the encoded size of a record.
     *
     * @param record the record
     * @return size in bytes
     */
    public static int calculateSize(Record record)
    {
        RecordLayout layout = layoutOf(record.getClass());
        int size = 0;
        for (int i = 0; i < layout.components().length; i++)
        {
            size += calculateValueSize(layout.read(record, i), layout.components()[i].getGenericType());
        }
        return size;
    }

    private static int calculateValueSize(Object value, Type type)
    {
        Class<?> rawType = getRawType(type);

        if (rawType == byte.class || rawType == Byte.class) return 1;
        if (rawType == short.class || rawType == Short.class) return 2;
        if (rawType == int.class || rawType == Integer.class) return 4;
        if (rawType == long.class || rawType == Long.class) return 8;
        if (rawType == float.class || rawType == Float.class) return 4;
        if (rawType == double.class || rawType == Double.class) return 8;
        if (rawType == boolean.class || rawType == Boolean.class) return 1;
        if (rawType == char.class || rawType == Character.class) return 2;

        if (rawType == String.class)
        {
            return 2 + ((String) value).getBytes(StandardCharsets.UTF_8).length;
        }

        if (rawType == byte[].class)
        {
            return 4 + ((byte[]) value).length;
        }

        if (rawType == List.class)
        {
            Type elementType = getTypeArgument(type, 0);
            int size = 2;
            for (Object element : (List<?>) value)
            {
                size += calculateValueSize(element, elementType);
            }
            return size;
        }

        if (rawType == Optional.class)
        {
            Optional<?> optional = (Optional<?>) value;
            if (optional.isPresent())
            {
                return 1 + calculateValueSize(optional.get(), getTypeArgument(type, 0));
            }
            return 1;
        }

        if (rawType.isEnum())
        {
            return 2;
        }

        if (rawType.isRecord())
        {
            return calculateSize((Record) value);
        }

        if (rawType.isSealed())
        {
            return 2 + calculateSize((Record) value);
        }

        throw new IllegalArgumentException("Unsupported type: " + rawType.getName());
    }

    // ========== Sealed variants ==========

    /**
     * Returns the record variants of a sealed interface in wire order.
     *
     * <p>Nested sealed interfaces are flattened; the result is sorted by
     * fully-qualified class name.</p>
     *
     * @param sealedType the sealed interface
     * @return its permitted records, in wire order
     */
    public static List<Class<? extends Record>> variantsOf(Class<?> sealedType)
    {
        return VARIANTS.computeIfAbsent(sealedType, type ->
        {
            List<Class<? extends Record>> variants = new ArrayList<>();
            collectVariants(type, variants);
            variants.sort(Comparator.comparing(Class::getName));
            return List.copyOf(variants);
        });
    }

    @SuppressWarnings("unchecked")
    private static void collectVariants(Class<?> sealedType, List<Class<? extends Record>> variants)
    {
        Class<?>[] permitted = sealedType.getPermittedSubclasses();
        if (permitted == null)
        {
            throw new IllegalArgumentException("Not a sealed type: " + sealedType.getName());
        }
        for (Class<?> subclass : permitted)
        {
            if (subclass.isRecord())
            {
                variants.add((Class<? extends Record>) subclass);
            }
            else if (subclass.isSealed())
            {
                collectVariants(subclass, variants);
            }
            else
            {
                throw new IllegalArgumentException(
                        "Permitted type must be a record or sealed interface: " + subclass.getName());
            }
        }
    }

    private static int variantIndex(Class<?> sealedType, Class<?> variant)
    {
        int index = variantsOf(sealedType).indexOf(variant);
        if (index < 0)
        {
            throw new IllegalArgumentException(variant.getName() + " is not a variant of " + sealedType.getName());
        }
        return index;
    }

    // ========== Record layouts ==========

    private static RecordLayout layoutOf(Class<?> recordClass)
    {
        return LAYOUTS.computeIfAbsent(recordClass, RecordLayout::of);
    }

    private record RecordLayout(RecordComponent[] components, Method[] accessors, Constructor<?> constructor)
    {
        static RecordLayout of(Class<?> recordClass)
        {
            if (!recordClass.isRecord())
            {
                throw new IllegalArgumentException("Not a record class: " + recordClass.getName());
            }
            RecordComponent[] components = recordClass.getRecordComponents();
            Method[] accessors = new Method[components.length];
            Class<?>[] argTypes = new Class<?>[components.length];
            for (int i = 0; i < components.length; i++)
            {
                accessors[i] = components[i].getAccessor();
                accessors[i].setAccessible(true);
                argTypes[i] = components[i].getType();
            }
            try
            {
                Constructor<?> constructor = recordClass.getDeclaredConstructor(argTypes);
                constructor.setAccessible(true);
                return new RecordLayout(components, accessors, constructor);
            }
            catch (NoSuchMethodException e)
            {
                throw new IllegalArgumentException("No canonical constructor: " + recordClass.getName(), e);
            }
        }

        Object read(Record record, int index)
        {
            try
            {
                return accessors[index].invoke(record);
            }
            catch (ReflectiveOperationException e)
            {
                throw new IllegalStateException("Failed to read component: " + components[index].getName(), e);
            }
        }

        Object construct(Object[] args)
        {
            try
            {
                return constructor.newInstance(args);
            }
            catch (java.lang.reflect.InvocationTargetException e)
            {
                // compact constructors reject values that decode fine structurally
                throw new CodecException("Invalid " + constructor.getDeclaringClass().getSimpleName()
                        + ": " + e.getCause().getMessage());
            }
            catch (ReflectiveOperationException e)
            {
                throw new IllegalStateException("Failed to construct record: " + constructor.getDeclaringClass().getName(), e);
            }
        }
    }

    // ========== Type utilities ==========

    static Class<?> getRawType(Type type)
    {
        if (type instanceof Class<?>)
        {
            return (Class<?>) type;
        }
        if (type instanceof ParameterizedType pt)
        {
            return (Class<?>) pt.getRawType();
        }
        throw new IllegalArgumentException("Cannot get raw type from: " + type);
    }

    static Type getTypeArgument(Type type, int index)
    {
        if (type instanceof ParameterizedType pt)
        {
            Type[] args = pt.getActualTypeArguments();
            if (index < args.length)
            {
                return args[index];
            }
        }
        throw new IllegalArgumentException("No type argument at index " + index + " for: " + type);
    }
}
