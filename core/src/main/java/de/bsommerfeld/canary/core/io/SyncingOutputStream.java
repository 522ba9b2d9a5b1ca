package de.bsommerfeld.canary.core.io;

import java.io.FileOutputStream;
import java.io.FilterOutputStream;
import java.io.IOException;

/**
 * Forces written bytes to the storage device before the underlying file is
 * closed. Wrap the innermost {@link FileOutputStream} with it; closing any
 * outer stream (gzip, tar) then implies an fsync.
 */
public final class SyncingOutputStream extends FilterOutputStream {

    private final FileOutputStream file;
    private boolean closed;

    public SyncingOutputStream(FileOutputStream file) {
        super(file);
        this.file = file;
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        file.write(b, off, len);
    }

    @Override
    public void close() throws IOException {
        if (closed)
            return;
        closed = true;
        try {
            file.flush();
            file.getFD().sync();
        } finally {
            file.close();
        }
    }
}
