package cladeguess.tree;

import java.util.*;

import org.json.simple.JSONObject;

import cladeguess.exceptions.DataFormatException;
import cladeguess.exceptions.TaxonNotFoundException;

/**
 * A rooted classification tree together with the indexes used to resolve scientific names and
 * species labels. The indexes belong to the tree; OutlineReader fills the name index and
 * SpeciesBinder fills the species index.
 */
public class TaxonTree {

	private TaxonNode root;

	private LinkedHashMap<String, TaxonNode> nodesByName; // preorder, as read from the outline

	private LinkedHashMap<String, TaxonNode> nodesBySpecies; // binding order

	public TaxonTree(TaxonNode root) {
		this.root = root;
		this.nodesByName = new LinkedHashMap<String, TaxonNode>();
		this.nodesBySpecies = new LinkedHashMap<String, TaxonNode>();
	}

	/**
	 * Creates a tree whose index already covers every node under `root`.
	 * @throws DataFormatException if two nodes share a name
	 */
	public static TaxonTree fromRoot(TaxonNode root) throws DataFormatException {
		TaxonTree tree = new TaxonTree(root);
		Stack<TaxonNode> nodes = new Stack<TaxonNode>();
		nodes.push(root);
		while (nodes.isEmpty() == false) {
			TaxonNode cur = nodes.pop();
			tree.registerNode(cur);
			for (int i = cur.getChildCount() - 1; i >= 0; i--) {
				nodes.push(cur.getChild(i));
			}
		}
		return tree;
	}

	public TaxonNode getRoot() {return root;}

	/**
	 * Adds `node` to the name index.
	 * @throws DataFormatException if the name is already taken
	 */
	void registerNode(TaxonNode node) throws DataFormatException {
		if (nodesByName.containsKey(node.getName())) {
			throw new DataFormatException("duplicate node name '" + node.getName() + "'");
		}
		nodesByName.put(node.getName(), node);
	}

	void registerSpecies(String label, TaxonNode node) {
		nodesBySpecies.put(label, node);
	}

	public boolean hasNode(String name) {return nodesByName.containsKey(name);}

	/**
	 * @return the node with scientific name `name`
	 * @throws TaxonNotFoundException if there is none
	 */
	public TaxonNode getNode(String name) throws TaxonNotFoundException {
		TaxonNode node = nodesByName.get(name);
		if (node == null) {
			throw new TaxonNotFoundException(name);
		}
		return node;
	}

	/**
	 * @return the node bound to the species label `label`
	 * @throws TaxonNotFoundException if no node carries that label
	 */
	public TaxonNode getSpeciesNode(String label) throws TaxonNotFoundException {
		TaxonNode node = nodesBySpecies.get(label);
		if (node == null) {
			throw new TaxonNotFoundException(label);
		}
		return node;
	}

	public int getNodeCount() {return nodesByName.size();}

	public int getSpeciesCount() {return nodesBySpecies.size();}

	/**
	 * @return the bound species labels, in binding order
	 */
	public Set<String> getSpeciesLabels() {return Collections.unmodifiableSet(nodesBySpecies.keySet());}

	/**
	 * @return every node, in outline (pre)order
	 */
	public Collection<TaxonNode> getNodes() {return Collections.unmodifiableCollection(nodesByName.values());}

	/**
	 * @return `node` followed by each of its ancestors up to and including the root
	 */
	public List<TaxonNode> getAncestors(TaxonNode node) {
		ArrayList<TaxonNode> path = new ArrayList<TaxonNode>();
		TaxonNode cur = node;
		while (cur != null) {
			path.add(cur);
			cur = cur.getParent();
		}
		return path;
	}

	/**
	 * Lowest common ancestor of two nodes of this tree. The deeper node is walked up until both
	 * sides sit at the same depth, then both are walked up in lockstep until they meet.
	 */
	public TaxonNode getMRCA(TaxonNode curn1, TaxonNode curn2) {
		TaxonNode a = curn1;
		TaxonNode b = curn2;
		while (a.getDepth() > b.getDepth()) {
			a = a.getParent();
		}
		while (b.getDepth() > a.getDepth()) {
			b = b.getParent();
		}
		while (a != b) {
			a = a.getParent();
			b = b.getParent();
			if (a == null || b == null) {
				throw new IllegalStateException("'" + curn1.getName() + "' and '" + curn2.getName() + "' do not share a root");
			}
		}
		return a;
	}

	/**
	 * @return the lowest common ancestor of the nodes bound to the given species labels
	 */
	public TaxonNode getMRCA(String... labels) throws TaxonNotFoundException {
		return getMRCA(Arrays.asList(labels));
	}

	public TaxonNode getMRCA(Collection<String> labels) throws TaxonNotFoundException {
		if (labels.isEmpty()) {
			throw new IllegalArgumentException("no species given");
		}
		Iterator<String> it = labels.iterator();
		TaxonNode mrca = getSpeciesNode(it.next());
		while (it.hasNext()) {
			mrca = getMRCA(mrca, getSpeciesNode(it.next()));
		}
		return mrca;
	}

	/**
	 * @return the whole tree in the nested form written next to the species listing
	 */
	public JSONObject toJSON() {
		return root.getJSON();
	}
}
