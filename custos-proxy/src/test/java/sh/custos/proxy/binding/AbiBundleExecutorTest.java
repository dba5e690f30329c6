// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.binding;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

import java.math.BigInteger;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import sh.custos.core.types.Address;
import sh.custos.core.types.Hash;
import sh.custos.core.types.HexData;
import sh.custos.core.types.Selector;
import sh.custos.proxy.spi.ContractCaller;

@ExtendWith(MockitoExtension.class)
class AbiBundleExecutorTest {

    private static final Address EXECUTOR = new Address("0x000000000000000000000000000000000000b0d1");
    private static final Address PROXY = new Address("0x000000000000000000000000000000000000c0de");
    private static final Address DISTRIBUTOR = new Address("0x0000000000000000000000000000000000d15700");
    private static final Address REWARD = new Address("0x000000000000000000000000000000000000f00d");
    private static final Hash LEAF = new Hash("0x" + "ab".repeat(32));

    @Mock
    private ContractCaller caller;

    @Test
    void claimInstructionEncodesUrdClaim() {
        HexData instruction = new AbiBundleExecutor(caller, EXECUTOR)
                .claimRewardInstruction(DISTRIBUTOR, PROXY, REWARD, BigInteger.valueOf(1_000_000), List.of(LEAF));

        assertEquals(Selector.of("urdClaim(address,address,address,uint256,bytes32[],bool)"),
                Selector.fromBytes(instruction.slice(0, 4).toBytes()));
        // 6 head words, then proof length and one proof word
        assertEquals(4 + 32 * 8, instruction.byteLength());
        String hex = instruction.value().substring(2 + 8);
        assertEquals(String.format("%064x", 0xc0), hex.substring(64 * 4, 64 * 5));
        assertEquals(String.format("%064x", 1), hex.substring(64 * 6, 64 * 7));
        assertEquals("ab".repeat(32), hex.substring(64 * 7, 64 * 8));
    }

    @Test
    void multicallWrapsBundleAndSendsFromCaller() {
        HexData first = new HexData("0xaabb");

        new AbiBundleExecutor(caller, EXECUTOR).multicall(PROXY, List.of(first));

        ArgumentCaptor<HexData> payload = ArgumentCaptor.forClass(HexData.class);
        verify(caller).call(eq(PROXY), eq(EXECUTOR), payload.capture());
        assertTrue(payload.getValue().value().startsWith("0xac9650d8"));
        assertTrue(payload.getValue().value().contains("aabb"));
    }
}
