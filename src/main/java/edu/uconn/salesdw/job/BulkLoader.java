package edu.uconn.salesdw.job;

import edu.uconn.salesdw.exception.ConnectivityException;
import edu.uconn.salesdw.exception.LoadInterruptedException;
import edu.uconn.salesdw.exception.SourceReadException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.zip.GZIPInputStream;

/**
 * Streams a gzip-compressed file into a bulk-copy channel line by line.
 * Lines are passed through byte for byte, terminators included.
 */
@Slf4j
public class BulkLoader {

    private static final int BUFFER_SIZE = 65536;
    private static final int PROGRESS_INTERVAL = 10_000;

    /**
     * Copies every decompressed line of the input into the channel and completes the copy.
     * The channel is aborted if anything fails.
     *
     * @return the number of lines written
     */
    public long load(Resource input, BulkCopyChannel channel) {
        long lines = 0;
        try (InputStream raw = open(input);
             InputStream in = new BufferedInputStream(new GZIPInputStream(raw, BUFFER_SIZE), BUFFER_SIZE)) {
            byte[] line;
            while ((line = readLine(in)) != null) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new LoadInterruptedException("Bulk load interrupted after " + lines + " lines");
                }
                channel.writeLine(line);
                lines++;
                if (lines % PROGRESS_INTERVAL == 0) {
                    log.debug("Streamed {} lines from {}", lines, input.getFilename());
                }
            }
            long accepted = channel.finish();
            log.info("Streamed {} lines from {} ({} rows accepted)", lines, input.getFilename(), accepted);
            return lines;
        } catch (IOException e) {
            channel.abort();
            throw new SourceReadException("Could not decompress " + input.getDescription(), e);
        } catch (RuntimeException e) {
            channel.abort();
            throw e;
        }
    }

    private static InputStream open(Resource input) {
        try {
            return input.getInputStream();
        } catch (IOException e) {
            throw new ConnectivityException("Could not open " + input.getDescription(), e);
        }
    }

    static byte[] readLine(InputStream in) throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        int b;
        while ((b = in.read()) != -1) {
            line.write(b);
            if (b == '\n') {
                break;
            }
        }
        return line.size() == 0 ? null : line.toByteArray();
    }
}
