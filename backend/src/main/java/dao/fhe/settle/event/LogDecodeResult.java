package dao.fhe.settle.event;

/**
 * Outcome of decoding one raw log. Malformed logs are reported, not thrown, so a single
 * bad log never aborts a scan.
 */
public sealed interface LogDecodeResult<T>
        permits LogDecodeResult.Matched, LogDecodeResult.NotThisType, LogDecodeResult.Malformed {

    record Matched<T>(T event) implements LogDecodeResult<T> {}

    record NotThisType<T>() implements LogDecodeResult<T> {}

    record Malformed<T>(String reason) implements LogDecodeResult<T> {}
}
