package asciigraf;

import static org.junit.Assert.*;

import java.io.File;
import java.io.FileNotFoundException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import asciigraf.exceptions.TooManyNodesOnEdgeException;
import asciigraf.graph.AsciiGraph;

public class AsciiGraphReaderTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private final AsciiGraphReader reader = new AsciiGraphReader();

	@Test
	public void testReadResource() throws Exception {
		AsciiGraph graph = reader.readResource("/diagrams/network.txt");
		assertEquals(4, graph.getNodeCount());
		assertEquals(3, graph.getEdgeCount());
		assertEquals("10", graph.getEdge("n1", "n2").getLabel());
		assertEquals(new Point(19, 2), graph.getNode("n3").getPosition());
	}

	@Test(expected = TooManyNodesOnEdgeException.class)
	public void testReadInvalidResource() throws Exception {
		reader.readResource("/diagrams/branching.txt");
	}

	@Test(expected = FileNotFoundException.class)
	public void testMissingResource() throws Exception {
		reader.readResource("/diagrams/no_such_diagram.txt");
	}

	@Test
	public void testReadFile() throws Exception {
		File f = folder.newFile("pair.txt");
		FileUtils.writeStringToFile(f, "a  ·\n|\n|\nb\n", StandardCharsets.UTF_8);
		AsciiGraph graph = reader.readFile(f);
		assertEquals(2, graph.getNodeCount());
		assertEquals(Integer.valueOf(2), graph.getEdge("a", "b").getLength());
	}
}
