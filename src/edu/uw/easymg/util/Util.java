package edu.uw.easymg.util;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.text.DecimalFormat;
import java.text.SimpleDateFormat;
import java.util.Calendar;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.zip.GZIPInputStream;

public class Util {

	private Util() {
	}

	public static File getFile(final String path) {
		return new File(path.replace("~", System.getProperty("user.home")));
	}

	private final static DecimalFormat twoDP = new DecimalFormat("#.00");

	public static String twoDP(final double number) {
		return twoDP.format(number);
	}

	public static Iterable<String> readFile(final File filePath) {
		return new Iterable<String>() {

			@Override
			public Iterator<String> iterator() {
				try {
					return readFileLineByLine(filePath);
				} catch (final IOException e) {
					throw new UncheckedIOException(e);
				}
			}
		};
	}

	public static Iterator<String> readFileLineByLine(final File filePath) throws IOException {
		InputStream stream = new FileInputStream(filePath);
		if (filePath.getName().endsWith(".gz")) {
			// Automatically unzip zipped files.
			stream = new GZIPInputStream(stream);
		}
		final BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));

		return new Iterator<String>() {
			String next = reader.readLine();

			@Override
			public boolean hasNext() {
				final boolean result = (next != null);
				if (!result) {
					try {
						reader.close();
					} catch (final IOException e) {
						throw new UncheckedIOException(e);
					}
				}

				return result;
			}

			@Override
			public String next() {
				if (next == null) {
					throw new NoSuchElementException();
				}
				final String result = next;
				try {
					next = reader.readLine();
				} catch (final IOException e) {
					throw new UncheckedIOException(e);
				}
				return result;
			}
		};
	}

	/**
	 * Writes timestamped messages to stderr, and optionally appends them to a file.
	 */
	public static class Logger {
		private final File file;
		private final SimpleDateFormat format = new SimpleDateFormat("HH:mm:ss");

		public Logger(final File file) {
			this.file = file;
		}

		public Logger() {
			this(null);
		}

		public void log(final String message) {
			final String toWrite = format.format(Calendar.getInstance().getTime()) + "\t" + message;
			System.err.println(toWrite);
			if (file == null) {
				return;
			}

			try (PrintWriter out = new PrintWriter(new BufferedWriter(new FileWriter(file, true)))) {
				out.println(toWrite);
			} catch (final IOException e) {
				System.err.println("ERROR WRITING TO LOG FILE: " + file.getAbsolutePath());
			}
		}
	}
}
