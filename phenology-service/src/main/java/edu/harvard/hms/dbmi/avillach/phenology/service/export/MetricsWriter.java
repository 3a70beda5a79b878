package edu.harvard.hms.dbmi.avillach.phenology.service.export;

import edu.harvard.hms.dbmi.avillach.phenology.data.metrics.MetricsRecord;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;

public interface MetricsWriter extends AutoCloseable {

    void writeHeader() throws IOException;

    void writeRecords(Collection<? extends MetricsRecord> records) throws IOException;

    long getRecordsWritten();

    Path getFile();

    @Override
    void close() throws IOException;
}
