package edu.upf.taln.amrreader.core.io;

import com.google.common.base.Stopwatch;
import edu.upf.taln.amrreader.core.structures.AlignmentRecord;
import edu.upf.taln.amrreader.core.structures.AlignmentType;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.tuple.Triple;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads and writes alignment records as JSON.
 * The alignments of one AMR are an array of {"type", "tokens", "nodes", "edges"} objects, with edges as
 * [source, role, target] arrays. A corpus is an object mapping AMR ids to such arrays.
 */
public class AlignmentsJSON
{
	private static final String TYPE = "type";
	private static final String TOKENS = "tokens";
	private static final String NODES = "nodes";
	private static final String EDGES = "edges";
	private final static Logger log = LogManager.getLogger();

	public static JSONObject toJSON(AlignmentRecord record)
	{
		JSONObject obj = new JSONObject();
		obj.put(TYPE, record.getType().getName());
		obj.put(TOKENS, new JSONArray(record.getTokens()));
		obj.put(NODES, new JSONArray(record.getNodes()));
		JSONArray edges = new JSONArray();
		for (Triple<String, String, String> e : record.getEdges())
		{
			JSONArray edge = new JSONArray();
			edge.put(e.getLeft());
			edge.put(e.getMiddle());
			edge.put(e.getRight());
			edges.put(edge);
		}
		obj.put(EDGES, edges);
		return obj;
	}

	public static JSONArray toJSON(Collection<AlignmentRecord> records)
	{
		JSONArray arr = new JSONArray();
		records.forEach(r -> arr.put(toJSON(r)));
		return arr;
	}

	public static JSONObject toJSON(Map<String, ? extends Collection<AlignmentRecord>> corpus)
	{
		JSONObject obj = new JSONObject();
		corpus.forEach((id, records) -> obj.put(id, toJSON(records)));
		return obj;
	}

	/**
	 * @throws JSONException if some field is missing, has the wrong JSON type or an unknown alignment type
	 */
	public static AlignmentRecord recordFromJSON(JSONObject obj)
	{
		String type_name = obj.getString(TYPE);
		AlignmentType type = AlignmentType.fromName(type_name).toJavaUtil()
				.orElseThrow(() -> new JSONException("Unknown alignment type " + type_name));

		List<Integer> tokens = new ArrayList<>();
		JSONArray tokens_arr = obj.getJSONArray(TOKENS);
		for (int i = 0; i < tokens_arr.length(); ++i)
			tokens.add(tokens_arr.getInt(i));

		List<String> nodes = new ArrayList<>();
		JSONArray nodes_arr = obj.getJSONArray(NODES);
		for (int i = 0; i < nodes_arr.length(); ++i)
			nodes.add(nodes_arr.getString(i));

		List<Triple<String, String, String>> edges = new ArrayList<>();
		JSONArray edges_arr = obj.optJSONArray(EDGES);
		if (edges_arr != null)
		{
			for (int i = 0; i < edges_arr.length(); ++i)
			{
				JSONArray edge = edges_arr.getJSONArray(i);
				if (edge.length() != 3)
					throw new JSONException("Edges must be [source, role, target] arrays: " + edge);
				edges.add(Triple.of(edge.getString(0), edge.getString(1), edge.getString(2)));
			}
		}

		try
		{
			return new AlignmentRecord(type, tokens, nodes, edges);
		}
		catch (IllegalArgumentException e)
		{
			throw new JSONException("Invalid alignment " + obj + ": " + e.getMessage(), e);
		}
	}

	public static List<AlignmentRecord> fromJSON(JSONArray arr)
	{
		List<AlignmentRecord> records = new ArrayList<>();
		for (int i = 0; i < arr.length(); ++i)
			records.add(recordFromJSON(arr.getJSONObject(i)));
		return records;
	}

	public static Map<String, List<AlignmentRecord>> corpusFromJSON(JSONObject obj)
	{
		// sorted for a deterministic iteration order, JSONObject keys are unordered
		Map<String, List<AlignmentRecord>> corpus = new TreeMap<>();
		for (String id : obj.keySet())
			corpus.put(id, fromJSON(obj.getJSONArray(id)));
		return corpus;
	}

	public static void write(Map<String, ? extends Collection<AlignmentRecord>> corpus, Path file) throws IOException
	{
		Stopwatch timer = Stopwatch.createStarted();
		FileUtils.writeStringToFile(file.toFile(), toJSON(corpus).toString(2), StandardCharsets.UTF_8);
		log.info("Alignments of " + corpus.size() + " AMRs written to " + file + " in " + timer.stop());
	}

	public static Map<String, List<AlignmentRecord>> read(Path file) throws IOException
	{
		Stopwatch timer = Stopwatch.createStarted();
		String json = FileUtils.readFileToString(file.toFile(), StandardCharsets.UTF_8);
		Map<String, List<AlignmentRecord>> corpus = corpusFromJSON(new JSONObject(json));
		log.info("Alignments of " + corpus.size() + " AMRs read from " + file + " in " + timer.stop());
		return corpus;
	}
}
