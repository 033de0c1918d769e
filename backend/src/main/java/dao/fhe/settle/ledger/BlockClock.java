package dao.fhe.settle.ledger;

/** Block height and wall time as seen by the local ledger. */
public interface BlockClock {

    long currentBlock();

    long nowSeconds();
}
