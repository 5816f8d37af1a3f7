package com.tracepulse.telemetry.backend;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends complete lines to a target. Only ever called from one worker thread.
 */
interface RecordAppender extends Closeable {

	/** Writes {@code line} plus a newline and flushes, so a crash leaves at most one partial trailing line. */
	void append(String line) throws IOException;

	/** Append-mode UTF-8 file writer; the handle is kept open and reopened after a failure. */
	static RecordAppender toFile(Path path) {
		return new RecordAppender() {
			private BufferedWriter writer;

			@Override
			public void append(String line) throws IOException {
				try {
					if (writer == null) {
						writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
								StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
					}
					writer.write(line);
					writer.write('\n');
					writer.flush();
				} catch (IOException e) {
					close();
					throw e;
				}
			}

			@Override
			public void close() throws IOException {
				final BufferedWriter w = writer;
				writer = null;
				if (w != null) w.close();
			}
		};
	}
}
