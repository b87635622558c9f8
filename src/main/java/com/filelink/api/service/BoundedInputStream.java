package com.filelink.api.service;

import com.filelink.api.exception.DenialReason;
import lombok.Getter;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.time.Clock;
import java.time.Instant;

/**
 * Fails the transfer once it reads more than {@code maxBytes}, runs past the deadline, or
 * the reading thread is interrupted.
 */
public class BoundedInputStream extends FilterInputStream {

    @Getter
    public static class TransferLimitException extends IOException {

        private final DenialReason reason;

        public TransferLimitException(DenialReason reason, String message) {
            super(message);
            this.reason = reason;
        }
    }

    private final long maxBytes;
    private final Clock clock;
    private final Instant deadline;
    private long count;

    public BoundedInputStream(InputStream in, long maxBytes, Clock clock, Instant deadline) {
        super(in);
        this.maxBytes = maxBytes;
        this.clock = clock;
        this.deadline = deadline;
    }

    @Override
    public int read() throws IOException {
        checkBudget();
        int b = super.read();
        if (b >= 0) {
            advance(1);
        }
        return b;
    }

    @Override
    public int read(byte[] buffer, int off, int len) throws IOException {
        checkBudget();
        int n = super.read(buffer, off, len);
        if (n > 0) {
            advance(n);
        }
        return n;
    }

    public long getCount() {
        return count;
    }

    private void advance(long n) throws TransferLimitException {
        count += n;
        if (count > maxBytes) {
            throw new TransferLimitException(DenialReason.SIZE_TOO_LARGE,
                    "Transfer exceeded " + maxBytes + " bytes");
        }
    }

    private void checkBudget() throws IOException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedIOException("Transfer cancelled");
        }
        if (deadline != null && clock.instant().isAfter(deadline)) {
            throw new TransferLimitException(DenialReason.TRANSFER_ABORTED, "Transfer exceeded its time budget");
        }
    }
}
