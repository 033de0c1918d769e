package dao.fhe.settle.ledger;

/** Block clock driven by the test. */
public class ManualBlockClock implements BlockClock {

    private long block;
    private long nowSeconds;

    public ManualBlockClock(long block, long nowSeconds) {
        this.block = block;
        this.nowSeconds = nowSeconds;
    }

    @Override
    public synchronized long currentBlock() {
        return block;
    }

    @Override
    public synchronized long nowSeconds() {
        return nowSeconds;
    }

    public synchronized void advanceBlocks(long blocks) {
        block += blocks;
    }

    public synchronized void advanceSeconds(long seconds) {
        nowSeconds += seconds;
    }
}
