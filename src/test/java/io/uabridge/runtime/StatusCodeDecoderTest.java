package io.uabridge.runtime;

import io.uabridge.model.StatusCodeInfo;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class StatusCodeDecoderTest {

    @Test
    void decodesSeverityAndKnownNames() {
        StatusCodeInfo good = StatusCodeDecoder.decode(0L);
        Assertions.assertEquals("Good", good.severity());
        Assertions.assertEquals("Good", good.symbolicName());
        Assertions.assertEquals("0x00000000", good.rawCode());

        StatusCodeInfo uncertain = StatusCodeDecoder.decode(0x40920000L);
        Assertions.assertEquals("Uncertain", uncertain.severity());
        Assertions.assertEquals("UncertainInitialValue", uncertain.symbolicName());

        StatusCodeInfo bad = StatusCodeDecoder.decode(0x80740000L);
        Assertions.assertEquals("Bad", bad.severity());
        Assertions.assertEquals("BadTypeMismatch", bad.symbolicName());
        Assertions.assertEquals(0x74, bad.subCode());
    }

    @Test
    void splitsFlagBitsFromCode() {
        StatusCodeInfo info = StatusCodeDecoder.decode(0x8034C003L);
        Assertions.assertEquals("BadNodeIdUnknown", info.symbolicName());
        Assertions.assertTrue(info.structureChanged());
        Assertions.assertTrue(info.semanticsChanged());
        Assertions.assertEquals(0x0003, info.infoBits());
        Assertions.assertEquals("0x8034C003", info.rawCode());
    }

    @Test
    void namesComeFromTheFullStatusCodeTable() {
        Assertions.assertEquals("BadTooManyOperations", StatusCodeDecoder.symbolicName(0x80100000L));
        Assertions.assertEquals("BadSecureChannelIdInvalid", StatusCodeDecoder.symbolicName(0x80220000L));
        Assertions.assertEquals("BadTooManyOperations", StatusCodeDecoder.decode(0x80100400L).symbolicName());
    }

    @Test
    void unknownCodesFallBackToSeverity() {
        Assertions.assertEquals("Bad", StatusCodeDecoder.symbolicName(0x8FFF0000L));
        Assertions.assertEquals("Uncertain", StatusCodeDecoder.symbolicName(0x4FFF0000L));
        Assertions.assertEquals("Unknown", StatusCodeDecoder.decode(0xC0000000L).severity());
    }
}
