package cladeguess;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

import cladeguess.exceptions.DataFormatException;
import cladeguess.tree.SpeciesRecord;

/**
 * Reads the species of a game from its JSON file, an array of objects such as
 * {"name": "cat", "scientific": "Felis catus"}. Any other keys are ignored.
 */
public class SpeciesListReader {
    static Logger _LOG = Logger.getLogger(SpeciesListReader.class);

    public List<SpeciesRecord> readSpecies(String filename) throws IOException, DataFormatException {
        _LOG.info("Reading species from file: " + filename);
        Reader r = new BufferedReader(new InputStreamReader(new FileInputStream(filename), StandardCharsets.UTF_8));
        try {
            return readSpecies(r);
        } finally {
            r.close();
        }
    }

    public List<SpeciesRecord> readSpecies(Reader r) throws IOException, DataFormatException {
        Object parsed;
        try {
            parsed = new JSONParser().parse(r);
        } catch (ParseException pe) {
            throw new DataFormatException("species list is not valid JSON: " + pe, pe);
        }
        if (!(parsed instanceof JSONArray)) {
            throw new DataFormatException("species list should be a JSON array");
        }
        ArrayList<SpeciesRecord> result = new ArrayList<SpeciesRecord>();
        int index = 0;
        for (Object o : (JSONArray) parsed) {
            if (!(o instanceof JSONObject)) {
                throw new DataFormatException("species entry " + index + " is not an object");
            }
            JSONObject entry = (JSONObject) o;
            Object name = entry.get("name");
            Object scientific = entry.get("scientific");
            if (!(name instanceof String) || !(scientific instanceof String)) {
                throw new DataFormatException("species entry " + index + " needs string \"name\" and \"scientific\" values");
            }
            result.add(new SpeciesRecord((String) name, (String) scientific));
            index++;
        }
        _LOG.info("Read " + result.size() + " species");
        return result;
    }
}
