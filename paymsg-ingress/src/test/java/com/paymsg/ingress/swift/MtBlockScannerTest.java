package com.paymsg.ingress.swift;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class MtBlockScannerTest {

    @Test
    public void testHeaderBlocks() {
        String text = "{1:F01SENDERUS33AXXX0000000000}{2:I103RECVGB22XXXXN}{4:\n:20:X\n-}";

        assertEquals("SENDERUS33AXXX", MtBlockScanner.senderAddress(text));
        assertEquals("RECVGB22XXXX", MtBlockScanner.receiverAddress(text));
        assertEquals(Optional.of("103"), MtBlockScanner.messageType(text));
    }

    @Test
    public void testLenientHeaderPatterns() {
        String text = "{1:F01BANKDEFF}{2:O202BANKGB22}";

        assertEquals("BANKDEFF", MtBlockScanner.senderAddress(text));
        assertEquals("BANKGB22", MtBlockScanner.receiverAddress(text));
        assertEquals(Optional.of("202"), MtBlockScanner.messageType(text));
        assertNull(MtBlockScanner.uetr(text));
    }

    @Test
    public void testRepeatedTagsAndContinuationLines() {
        String text = "{4:\r\n:61:LINE ONE\r\n:86:FIRST\r\nSECOND LINE\r\n:61:LINE TWO\r\n-}";

        List<MtField> fields = MtBlockScanner.fields(text);

        assertEquals(3, fields.size());
        assertEquals(new MtField("61", "LINE ONE"), fields.get(0));
        assertEquals("FIRST\nSECOND LINE", fields.get(1).getValue());
        assertEquals("61", fields.get(2).getTag());
    }

    @Test
    public void testNoBlock4() {
        assertTrue(MtBlockScanner.fields("{1:F01BANKUS33AXXX0000000000}").isEmpty());
        assertEquals(Optional.empty(), MtBlockScanner.messageType("{1:F01BANKUS33AXXX0000000000}"));
    }
}
