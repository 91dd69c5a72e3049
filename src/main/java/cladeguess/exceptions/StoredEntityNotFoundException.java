package cladeguess.exceptions;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Base class for exceptions raised when an entity that was expected to be found in the taxonomy
 * (a scientific name, a species label) is not there.
 */
public class StoredEntityNotFoundException extends Exception {

    private static final long serialVersionUID = 1L;
    private String singularEntity;
    private String pluralEntity;
    private ArrayList<String> missingNames;

    // single name constructor
    public StoredEntityNotFoundException(String missingName, String singularEntityName, String pluralEntityName) {
        this.singularEntity = singularEntityName;
        this.pluralEntity = pluralEntityName;
        this.missingNames = new ArrayList<String>();
        this.missingNames.add(missingName);
    }

    // list of names constructor
    public StoredEntityNotFoundException(List<String> missingNames, String singularEntityName, String pluralEntityName) {
        this.singularEntity = singularEntityName;
        this.pluralEntity = pluralEntityName;
        this.missingNames = new ArrayList<String>();
        this.missingNames.addAll(missingNames);
    }

    private String getNames() {
        return StringUtils.join(this.missingNames, ", ");
    }

    public List<String> getMissingNames() {
        return this.missingNames;
    }

    public String getQuotedName() {
        return "'" + this.getNames() + "'";
    }

    @Override
    public String getMessage() {
        return this.toString();
    }

    @Override
    public String toString() {
        return this.singularEntity + " \"" + this.getNames() + "\" is not recognized.";
    }

    public void reportFailedAction(PrintStream out, String failedAction) {
        String noun = (missingNames.size() == 1 ? this.singularEntity : this.pluralEntity);
        out.println(failedAction + " failed; " + noun + " not recognized: " + this.getQuotedName());
    }
}
