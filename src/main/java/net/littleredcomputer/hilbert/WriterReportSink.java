package net.littleredcomputer.hilbert;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;

public class WriterReportSink implements ReportSink, Closeable {
    private final Writer w;

    public WriterReportSink(Writer w) {
        this.w = w;
    }

    @Override
    public void println(String text) {
        try {
            w.write(text);
            w.write('\n');
        } catch (IOException e) {
            throw new ReportException("unable to write report", e);
        }
    }

    @Override
    public void flush() {
        try {
            w.flush();
        } catch (IOException e) {
            throw new ReportException("unable to flush report", e);
        }
    }

    @Override
    public void close() throws IOException {
        w.close();
    }
}
