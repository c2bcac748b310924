package space.ketterling.marinedata.db;

/**
 * Outcome of writing one table's share of a record.
 *
 * @param rows   rows upserted
 * @param detail skip reason or error message, null when written
 */
public record WriteResult(String table, Status status, int rows, String detail) {

    public enum Status {
        WRITTEN,
        SKIPPED,
        FAILED
    }

    public static WriteResult written(String table, int rows) {
        return new WriteResult(table, Status.WRITTEN, rows, null);
    }

    public static WriteResult skipped(String table, String reason) {
        return new WriteResult(table, Status.SKIPPED, 0, reason);
    }

    public static WriteResult failed(String table, String error) {
        return new WriteResult(table, Status.FAILED, 0, error);
    }

    public boolean isFailure() {
        return status == Status.FAILED;
    }
}
