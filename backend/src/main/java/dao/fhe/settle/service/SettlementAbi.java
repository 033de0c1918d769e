package dao.fhe.settle.service;

import dao.fhe.settle.model.InternalizedTransfer;
import dao.fhe.settle.model.NetSwap;
import dao.fhe.settle.model.Settlement;
import dao.fhe.settle.util.HexUtil;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.DynamicStruct;
import org.web3j.abi.datatypes.StaticStruct;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * ABI shapes shared by the settlement hash and the hook contract's {@code settleBatch}.
 * <pre>
 * struct Transfer { bytes32 intentIdA; bytes32 intentIdB; address userA; address userB;
 *                   address tokenA; address tokenB; uint256 amountA; uint256 amountB; }
 * struct NetSwap  { address tokenIn; address tokenOut; uint256 netAmount; bytes32[] intentIds; }
 * </pre>
 */
public final class SettlementAbi {
    private SettlementAbi() {}

    public static final String TRANSFER_TUPLE = "(bytes32,bytes32,address,address,address,address,uint256,uint256)";
    public static final String NET_SWAP_TUPLE = "(address,address,uint256,bytes32[])";
    public static final String SETTLE_BATCH_SIGNATURE =
            "settleBatch(bytes32,bytes32," + TRANSFER_TUPLE + "[]," + NET_SWAP_TUPLE + "[],bytes[])";

    public static StaticStruct transfer(String intentIdA, String intentIdB,
                                        String userA, String userB,
                                        String tokenA, String tokenB,
                                        BigInteger amountA, BigInteger amountB) {
        return new StaticStruct(
                new Bytes32(HexUtil.bytes32(intentIdA)),
                new Bytes32(HexUtil.bytes32(intentIdB)),
                new Address(userA),
                new Address(userB),
                new Address(tokenA),
                new Address(tokenB),
                new Uint256(amountA),
                new Uint256(amountB));
    }

    public static DynamicStruct netSwap(NetSwap swap) {
        List<Bytes32> ids = new ArrayList<>();
        for (String id : swap.remainingIntentIds()) {
            ids.add(new Bytes32(HexUtil.bytes32(id)));
        }
        return new DynamicStruct(
                new Address(swap.tokenIn()),
                new Address(swap.tokenOut()),
                new Uint256(swap.netAmount()),
                new DynamicArray<>(Bytes32.class, ids));
    }

    public static DynamicArray<StaticStruct> transferArray(List<StaticStruct> transfers) {
        return new DynamicArray<>(StaticStruct.class, transfers);
    }

    public static DynamicArray<DynamicStruct> netSwapArray(List<NetSwap> netSwaps) {
        List<DynamicStruct> structs = new ArrayList<>();
        for (NetSwap swap : netSwaps) {
            structs.add(netSwap(swap));
        }
        return new DynamicArray<>(DynamicStruct.class, structs);
    }

    /**
     * {@code abi.encode(bytes32 batchId, Transfer[] transfers, NetSwap[] netSwaps)} with
     * cleartext amounts; signatures are not part of it.
     */
    @SuppressWarnings("rawtypes")
    public static String canonicalEncoding(Settlement settlement) {
        List<StaticStruct> transfers = new ArrayList<>();
        for (InternalizedTransfer t : settlement.internalizedTransfers()) {
            transfers.add(transfer(t.intentIdA(), t.intentIdB(), t.userA(), t.userB(),
                    t.tokenA(), t.tokenB(), t.amountA(), t.amountB()));
        }
        List<Type> params = Arrays.asList(
                new Bytes32(HexUtil.bytes32(settlement.batchId())),
                transferArray(transfers),
                netSwapArray(settlement.netSwaps()));
        return FunctionEncoder.encodeConstructor(params);
    }
}
