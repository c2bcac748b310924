package space.ketterling.marinedata.ingest;

import space.ketterling.marinedata.db.MarineRecordWriter;
import space.ketterling.marinedata.db.WriteResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Routes a record and writes each table's share. A failed table does not stop
 * the others.
 */
public class RecordPipeline {
    private final FieldRouter router;
    private final MarineRecordWriter writer;
    private final LatestValues latest;

    public RecordPipeline(FieldRouter router, MarineRecordWriter writer, LatestValues latest) {
        this.router = router;
        this.writer = writer;
        this.latest = latest;
    }

    public List<WriteResult> accept(CollectionRecord record) {
        FieldRouter.RoutedRecord routed = router.route(record);
        if (!routed.archive().isEmpty())
            latest.update(routed.archive());

        List<WriteResult> results = new ArrayList<>();
        for (Map.Entry<String, Map<String, Object>> e : routed.tables().entrySet()) {
            results.add(writer.persist(e.getKey(), record.stationId(), record.collectedAt(), e.getValue()));
        }
        return results;
    }
}
