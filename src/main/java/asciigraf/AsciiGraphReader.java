package asciigraf;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.apache.log4j.Logger;

import asciigraf.exceptions.InvalidEdgeException;
import asciigraf.graph.AsciiGraph;

/**
 * Reads diagrams stored as UTF-8 text files, either on disk or on the classpath.
 */
public class AsciiGraphReader {

	static Logger _LOG = Logger.getLogger(AsciiGraphReader.class);

	private final AsciiGraphParser parser;

	public AsciiGraphReader() {
		this(new AsciiGraphParser());
	}

	public AsciiGraphReader(AsciiGraphParser parser) {
		this.parser = parser;
	}

	public AsciiGraph readFile(File file) throws IOException, InvalidEdgeException {
		_LOG.debug("reading diagram from " + file);
		return this.parser.graphFromAscii(FileUtils.readFileToString(file, StandardCharsets.UTF_8));
	}

	/**
	 * @param resource an absolute classpath resource name, e.g. "/diagrams/triangle.txt"
	 * @throws FileNotFoundException if the resource does not exist
	 */
	public AsciiGraph readResource(String resource) throws IOException, InvalidEdgeException {
		InputStream in = AsciiGraphReader.class.getResourceAsStream(resource);
		if (in == null) {
			throw new FileNotFoundException("diagram resource not found: " + resource);
		}
		try {
			_LOG.debug("reading diagram from classpath resource " + resource);
			return this.parser.graphFromAscii(IOUtils.toString(in, StandardCharsets.UTF_8));
		} finally {
			in.close();
		}
	}
}
