package io.uabridge.write;

import io.uabridge.protocol.BuiltinType;
import io.uabridge.protocol.TypedValue;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

final class TypedValueParserTest {

    @Test
    void byteStringAcceptsSeparatedAndPrefixedHex() {
        byte[] expected = {0x43, 0x45, (byte) 0xDE};
        Assertions.assertArrayEquals(expected, TypedValueParser.parseByteString("43 45 DE"));
        Assertions.assertArrayEquals(expected, TypedValueParser.parseByteString("0x43,0x45,0xDE"));
        Assertions.assertArrayEquals(expected, TypedValueParser.parseByteString("hex:4345de"));
        Assertions.assertArrayEquals(expected, TypedValueParser.parseByteString("43:45:de"));
    }

    @Test
    void byteStringTextPrefixesAndOddHexKeepRawBytes() {
        Assertions.assertArrayEquals("abcd".getBytes(StandardCharsets.UTF_8), TypedValueParser.parseByteString("ascii:abcd"));
        Assertions.assertArrayEquals("hello".getBytes(StandardCharsets.UTF_8), TypedValueParser.parseByteString("text: hello"));
        Assertions.assertArrayEquals("abc".getBytes(StandardCharsets.UTF_8), TypedValueParser.parseByteString("abc"));
        Assertions.assertEquals(0, TypedValueParser.parseByteString("  ").length);
    }

    @Test
    void scalarTypesHonourTheirRanges() throws Exception {
        Assertions.assertEquals(new TypedValue.UInt16Value(65535), TypedValueParser.parseScalar("65535", BuiltinType.UINT16));
        Assertions.assertEquals(new TypedValue.UInt64Value(new BigInteger("18446744073709551615")),
                TypedValueParser.parseScalar("18446744073709551615", BuiltinType.UINT64));
        Assertions.assertThrows(ValueConversionException.class, () -> TypedValueParser.parseScalar("65536", BuiltinType.UINT16));
        Assertions.assertThrows(ValueConversionException.class, () -> TypedValueParser.parseScalar("-1", BuiltinType.UINT32));
        Assertions.assertThrows(ValueConversionException.class, () -> TypedValueParser.parseScalar("abc", BuiltinType.INT32));
    }

    @Test
    void typeNamesResolveCaseInsensitivelyWithAliases() throws Exception {
        Assertions.assertEquals(new TypedValue.FloatValue(1.5f), TypedValueParser.parseScalar("1.5", "float32"));
        Assertions.assertEquals(new TypedValue.DoubleValue(2.5), TypedValueParser.parseScalar("2.5", "float64"));
        Assertions.assertEquals(new TypedValue.BooleanValue(true), TypedValueParser.parseScalar("1", "BOOLEAN"));
        Assertions.assertThrows(ValueConversionException.class, () -> TypedValueParser.parseScalar("1", "Matrix"));
    }

    @Test
    void stringKeepsSurroundingWhitespace() throws Exception {
        Assertions.assertEquals(new TypedValue.StringValue("  padded "), TypedValueParser.parseScalar("  padded ", BuiltinType.STRING));
    }

    @Test
    void arrayLiteralSkipsBlankItemsAndRejectsEmptyInput() throws Exception {
        TypedValue.ArrayValue array = TypedValueParser.parseArray("[1, , 2]", BuiltinType.INT32);
        Assertions.assertEquals(2, array.elements().size());
        Assertions.assertThrows(ValueConversionException.class, () -> TypedValueParser.parseArray("[]", BuiltinType.INT32));
        Assertions.assertThrows(ValueConversionException.class, () -> TypedValueParser.parseArray("1,2", BuiltinType.BYTE_STRING));
    }
}
