/**
 * IO.java
 */
package hep.afw;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Utility class for file and stream operations, including path resolution,
 * atomic file publication and resource management.
 */
public final class IO {

	private static final Pattern ENV = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)\\}");

	private IO() {
	}

	/**
	 * Resolves {@code ~} and {@code ${NAME}} environment references.
	 * Unknown variables resolve to an empty string.
	 */
	public static File path(final String path) {
		String s = path;
		if (s.startsWith("~"))
			s = System.getProperty("user.home") + s.substring(1);
		final Matcher m = ENV.matcher(s);
		final StringBuilder sb = new StringBuilder();
		while (m.find()) {
			final String name = m.group(1);
			String v = System.getenv(name);
			if (v == null && "HOME".equals(name))
				v = System.getProperty("user.home");
			m.appendReplacement(sb, Matcher.quoteReplacement(v == null ? "" : v));
		}
		m.appendTail(sb);
		return new File(sb.toString());
	}

	/**
	 * Escapes a dataset key such as {@code /TTTo2L2Nu/Run3Summer22EE/NANOAODSIM} to a
	 * single directory name.
	 */
	public static String escapeName(final String dataset) {
		String safe = dataset.replace(File.separator, "_").replace("/", "_");
		if (safe.startsWith("_"))
			safe = safe.substring(1);
		return safe;
	}

	/**
	 * Writes a file through a temporary sibling and renames it into place, so
	 * readers never observe a half-written file.
	 * 
	 * @param target    destination file
	 * @param overwrite whether an existing target may be replaced
	 * @param writer    body writing the content
	 */
	public static void writeAtomic(final File target, final boolean overwrite, final Writer writer) throws IOException {
		final File parent = target.getAbsoluteFile().getParentFile();
		Files.createDirectories(parent.toPath());
		if (!overwrite && target.exists())
			throw new FileAlreadyExistsException(target.getPath());

		final Path temp = Files.createTempFile(parent.toPath(), "." + target.getName() + ".", ".tmp");
		try {
			try (OutputStream os = Files.newOutputStream(temp)) {
				writer.write(os);
			}
			move(temp, target.toPath(), overwrite);
		} finally {
			Files.deleteIfExists(temp);
		}
	}

	/**
	 * Publishes a file produced elsewhere (for example by a format library that
	 * insists on opening its own output) into its final place.
	 */
	public static void move(final Path source, final Path target, final boolean overwrite) throws IOException {
		if (!overwrite && Files.exists(target))
			throw new FileAlreadyExistsException(target.toString());
		try {
			if (overwrite)
				Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
			else
				Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
		} catch (AtomicMoveNotSupportedException ex) {
			if (overwrite)
				Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
			else
				Files.move(source, target);
		}
	}

	public static void deleteRecursively(final File dir) throws IOException {
		if (!dir.exists())
			return;
		try (Stream<Path> walk = Files.walk(dir.toPath())) {
			final Path[] paths = walk.sorted(Comparator.reverseOrder()).toArray(Path[]::new);
			for (final Path p : paths)
				Files.delete(p);
		}
	}

	public static String readableBytesSize(final long bytes) {
		long v = bytes;
		if (v <= 0)
			return "0";

		final String[] units = new String[] { "B", "K", "M", "G", "T" };

		int digitGroups = (int) (Math.log10(v) / Math.log10(1024));
		return new DecimalFormat("#,##0.#").format(v / Math.pow(1024, digitGroups)) + "" + units[digitGroups];
	}

	/**
	 * Content writer for {@link IO#writeAtomic(File, boolean, Writer)}
	 */
	@FunctionalInterface
	public interface Writer {
		void write(OutputStream os) throws IOException;
	}

	/**
	 * A utility class for managing resources that need to be closed.
	 * Resources are closed in reverse order of their registration; the first
	 * failure is rethrown after every resource had its chance to close.
	 */
	public static final class Closer implements AutoCloseable {
		final ArrayList<AutoCloseable> a = new ArrayList<>();

		public Closer() {
		}

		/**
		 * Registers a closeable resource.
		 * @param <T> the type of the object
		 * @param object the object to register
		 * @return the registered object
		 */
		public <T extends AutoCloseable> T register(final T object) {
			if (null != object)
				a.add(object);
			return object;
		}

		/**
		 * Close all registered resources in reverse order
		 */
		@Override
		public void close() throws IOException {
			Exception first = null;
			for (int i = a.size() - 1; i >= 0; i--) {
				try {
					a.get(i).close();
				} catch (Exception ex) {
					if (first == null)
						first = ex;
					else
						first.addSuppressed(ex);
				}
			}
			a.clear();
			if (first instanceof IOException io)
				throw io;
			if (first != null)
				throw new IOException(first);
		}
	}

	/**
	 * A simple stopwatch utility for measuring elapsed time.
	 */
	public static final class StopWatch {
		private long start;

		public StopWatch() {
			reset();
		}

		public void reset() {
			start = System.nanoTime();
		}

		/** elapsed milliseconds */
		public long elapsed() {
			return (System.nanoTime() - start) / 1_000_000L;
		}

		public long elapsed(boolean reset) {
			final long v = elapsed();
			if (reset)
				reset();
			return v;
		}

		/**
		 * Operations per second for {@code count} operations over {@code ms}.
		 */
		public static long ops(final long count, final long ms) {
			if (ms <= 0)
				return count * 1000L;
			return (long) (count * 1000.0 / ms);
		}
	}
}
