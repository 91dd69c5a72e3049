package cladeguess.tree;

import java.util.*;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

/**
 * A named clade of the classification outline. The node owns its children; the parent is a
 * plain back-reference set once, when the node is attached.
 */
public class TaxonNode {
	private final String name;
	private int depth;
	private TaxonNode parent;
	private ArrayList<TaxonNode> children;
	private LinkedHashSet<String> leafSpecies; // labels of the species at or below this node
	private String species; // label bound to this node itself, or null

	public TaxonNode(String name) {
		this.name = name;
		this.depth = 0;
		this.parent = null;
		this.children = new ArrayList<TaxonNode>();
		this.leafSpecies = new LinkedHashSet<String>();
		this.species = null;
	}

	public List<TaxonNode> getChildren() {return Collections.unmodifiableList(this.children);}

	public boolean isExternal() {return (this.children.size() < 1);}

	public boolean isInternal() {return (this.children.size() > 0);}

	public boolean isTheRoot() {return (this.parent == null);}

	public TaxonNode getParent() {return this.parent;}

	public int getChildCount() {return this.children.size();}

	public String getName() {return this.name;}

	public int getDepth() {return this.depth;}

	/**
	 * Appends `c` as the last child of this node and fixes the depths of `c` and everything below it.
	 * @throws IllegalStateException if `c` already has a parent
	 */
	public void addChild(TaxonNode c) {
		if (c.parent != null) {
			throw new IllegalStateException("node '" + c.getName() + "' is already a child of '" + c.parent.getName() + "'");
		}
		this.children.add(c);
		c.parent = this;
		Stack<TaxonNode> nodes = new Stack<TaxonNode>();
		nodes.push(c);
		while (nodes.isEmpty() == false) {
			TaxonNode cur = nodes.pop();
			cur.depth = cur.parent.depth + 1;
			for (TaxonNode child : cur.children) {
				nodes.push(child);
			}
		}
	}

	/**
	 * @return the c-th child or throw IndexOutOfBoundsException.
	 */
	public TaxonNode getChild(int c) throws IndexOutOfBoundsException {
		return this.children.get(c);
	}

	public boolean isSpecies() {return (this.species != null);}

	public String getSpecies() {return this.species;}

	void setSpecies(String label) {this.species = label;}

	public Set<String> getLeafSpecies() {return Collections.unmodifiableSet(this.leafSpecies);}

	public int getLeafSpeciesCount() {return this.leafSpecies.size();}

	void addLeafSpecies(String label) {this.leafSpecies.add(label);}

	/**
	 * @return true if `other` is this node or one of its descendants
	 */
	public boolean isAncestorOf(TaxonNode other) {
		TaxonNode cur = other;
		while (cur != null && cur.depth >= this.depth) {
			if (cur == this) {
				return true;
			}
			cur = cur.parent;
		}
		return false;
	}

	/**
	 * @return the subtree rooted at this node as nested {"scientific", "depth", "label", "children"} objects.
	 *		Only species nodes carry a "label" key and leaves carry no "children" key.
	 */
	@SuppressWarnings("unchecked")
	public JSONObject getJSON() {
		JSONObject ret = new JSONObject();
		ret.put("scientific", this.name);
		ret.put("depth", this.depth);
		if (this.species != null) {
			ret.put("label", this.species);
		}
		if (this.isInternal()) {
			JSONArray kids = new JSONArray();
			for (TaxonNode child : this.children) {
				kids.add(child.getJSON());
			}
			ret.put("children", kids);
		}
		return ret;
	}

	@Override
	public String toString() {
		return "TaxonNode(" + this.name + ", depth=" + this.depth + ", leaves=" + this.leafSpecies.size() + ")";
	}
}
