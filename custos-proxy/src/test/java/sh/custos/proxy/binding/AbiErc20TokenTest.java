// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.binding;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import sh.custos.core.types.Address;
import sh.custos.core.types.HexData;
import sh.custos.proxy.error.TokenCallFailedException;
import sh.custos.proxy.spi.ContractCaller;

@ExtendWith(MockitoExtension.class)
class AbiErc20TokenTest {

    private static final Address TOKEN = new Address("0x000000000000000000000000000000000000a55e");
    private static final Address HOLDER = new Address("0x000000000000000000000000000000000000c0de");
    private static final Address SPENDER = new Address("0x000000000022d473030f116ddee9f6b43ac78ba3");

    private static final String PADDED_HOLDER = "000000000000000000000000000000000000000000000000000000000000c0de";

    @Mock
    private ContractCaller caller;

    private static HexData word(long value) {
        return new HexData("0x" + String.format("%064x", value));
    }

    @Test
    void balanceOfEncodesHolderAndDecodesWord() {
        when(caller.call(Address.ZERO, TOKEN, new HexData("0x70a08231" + PADDED_HOLDER))).thenReturn(word(42));

        assertEquals(BigInteger.valueOf(42), new AbiErc20Token(caller, TOKEN).balanceOf(HOLDER));
    }

    @Test
    void transferIsSentByTheSender() {
        when(caller.call(eq(HOLDER), eq(TOKEN), any())).thenReturn(word(1));

        new AbiErc20Token(caller, TOKEN).transfer(HOLDER, SPENDER, BigInteger.TEN);

        ArgumentCaptor<HexData> payload = ArgumentCaptor.forClass(HexData.class);
        verify(caller).call(eq(HOLDER), eq(TOKEN), payload.capture());
        assertEquals("0xa9059cbb"
                + "000000000000000000000000000000000022d473030f116ddee9f6b43ac78ba3"
                + String.format("%064x", 10), payload.getValue().value());
    }

    @Test
    void falseReturnFails() {
        when(caller.call(eq(HOLDER), eq(TOKEN), any())).thenReturn(word(0));

        TokenCallFailedException e = assertThrows(TokenCallFailedException.class,
                () -> new AbiErc20Token(caller, TOKEN).approve(HOLDER, SPENDER, BigInteger.ONE));
        assertEquals("approve", e.function());
        assertEquals(TOKEN, e.token());
    }

    @Test
    void emptyReturnIsAccepted() {
        when(caller.call(eq(HOLDER), eq(TOKEN), any())).thenReturn(HexData.EMPTY);

        assertDoesNotThrow(() -> new AbiErc20Token(caller, TOKEN).transfer(HOLDER, SPENDER, BigInteger.ONE));
    }

    @Test
    void allowanceDecodesWord() {
        when(caller.call(eq(Address.ZERO), eq(TOKEN), any())).thenReturn(word(7));

        assertEquals(BigInteger.valueOf(7), new AbiErc20Token(caller, TOKEN).allowance(HOLDER, SPENDER));
    }
}
