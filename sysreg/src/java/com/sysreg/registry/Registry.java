/*

Copyright (C) SYSTAP, LLC 2006-2008.  All rights reserved.

Contact:
     SYSTAP, LLC
     4501 Tower Road
     Greensboro, NC 27410
     licenses@bigdata.com

This program is free software; you can redistribute it and/or modify
it under the terms of the GNU General Public License as published by
the Free Software Foundation; version 2 of the License.

This program is distributed in the hope that it will be useful,
but WITHOUT ANY WARRANTY; without even the implied warranty of
MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
GNU General Public License for more details.

You should have received a copy of the GNU General Public License
along with this program; if not, write to the Free Software
Foundation, Inc., 59 Temple Place, Suite 330, Boston, MA  02111-1307  USA

*/
package com.sysreg.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.log4j.Logger;

import com.sysreg.attr.AttributeDescriptor;
import com.sysreg.attr.NodeType;
import com.sysreg.attr.ValidationError;
import com.sysreg.config.BooleanValidator;
import com.sysreg.config.Configuration;
import com.sysreg.render.IRenderer;

/**
 * The root container of a tree of {@link Node}s (the analogue of a kset). The
 * registry mediates the creation of nodes (linking them into their container
 * and publishing them through the {@link IRenderer}) and their destruction
 * (dropping references and finalizing a node once its reference count reaches
 * zero).
 * <p>
 * Finalization unpublishes the node, removes it from its container, detaches
 * its children (they are not destroyed), invokes the
 * {@link NodeType#getRelease() release} callback exactly once and clears the
 * payload. A node is never finalized while a reference is held on it, e.g.,
 * by an in-flight dispatch.
 * <p>
 * Structural edits are serialized per container: the monitor of the parent
 * node for children, and the monitor of the root collection for root nodes.
 * 
 * @version $Id$
 */
public class Registry {

    protected static final Logger log = Logger.getLogger(Registry.class);

    /**
     * Options for the {@link Registry}. Each option may be overridden for a
     * specific registry using its name as the namespace.
     * 
     * @see Configuration
     */
    public interface Options {

        /**
         * When <code>true</code> the {@link IRegistryListener} is notified as
         * nodes are added and removed.
         */
        String NOTIFY_LISTENERS = Registry.class.getName()
                + ".notifyListeners";

        String DEFAULT_NOTIFY_LISTENERS = "true";

    }

    /**
     * A listener which ignores all events.
     */
    public static final IRegistryListener NOP_LISTENER = new IRegistryListener() {

        public void nodeAdded(INode node) {
            // NOP
        }

        public void nodeRemoved(INode node) {
            // NOP
        }

    };

    private final String name;

    private final IRenderer renderer;

    private final Properties properties;

    private final boolean notifyListeners;

    private final Map<String, Node> roots = new ConcurrentHashMap<String, Node>();

    private volatile IRegistryListener listener = NOP_LISTENER;

    /**
     * The roots created by {@link #initialize(List)} in creation order.
     * Guarded by <code>this</code>.
     */
    private final List<INode> declared = new ArrayList<INode>();

    private boolean initialized = false;

    private boolean exited = false;

    /**
     * @param name
     *            The name of the registry. It is used as the namespace when
     *            resolving the {@link Options}.
     * @param renderer
     *            The renderer used to publish nodes.
     * @param properties
     *            The configuration properties.
     */
    public Registry(final String name, final IRenderer renderer,
            final Properties properties) {

        if (name == null)
            throw new IllegalArgumentException();

        if (renderer == null)
            throw new IllegalArgumentException();

        if (properties == null)
            throw new IllegalArgumentException();

        this.name = name;

        this.renderer = renderer;

        this.properties = properties;

        this.notifyListeners = Configuration.getProperty(properties, name,
                Options.NOTIFY_LISTENERS, Options.DEFAULT_NOTIFY_LISTENERS,
                BooleanValidator.DEFAULT);

    }

    public String getName() {

        return name;

    }

    public IRenderer getRenderer() {

        return renderer;

    }

    /**
     * The properties used to configure the registry and its collaborators.
     */
    public Properties getProperties() {

        return properties;

    }

    public IRegistryListener getListener() {

        return listener;

    }

    /**
     * Set the listener.
     * 
     * @param listener
     *            The listener -or- <code>null</code> to remove the listener.
     */
    public void setListener(final IRegistryListener listener) {

        this.listener = listener == null ? NOP_LISTENER : listener;

    }

    /**
     * Create a node without a payload.
     * 
     * @see #create(String, NodeType, INode, Object)
     */
    public INode create(final String name, final NodeType type,
            final INode parent) throws RegistryException {

        return create(name, type, parent, null/* payload */);

    }

    /**
     * Create a node, link it into its container and publish it. The caller
     * owns the returned handle and must eventually {@link #destroy(INode)} it.
     * 
     * @param name
     *            The name of the node, which must be unique within the
     *            container.
     * @param type
     *            The type of the node.
     * @param parent
     *            The parent -or- <code>null</code> to create a root node.
     * @param payload
     *            The payload (optional).
     * 
     * @return The node, with a reference count of ONE (1).
     * 
     * @throws IllegalArgumentException
     *             if the name or the type is <code>null</code>.
     * @throws ValidationError
     *             if the name is empty or contains the
     *             {@link INode#pathSeparator}.
     * @throws NodeDestroyedException
     *             if the parent is no longer live.
     * @throws DuplicateNodeException
     *             if the container already has a node with that name.
     * @throws PublishFailedException
     *             if the renderer rejects the node. The node has been removed
     *             from its container again.
     */
    public INode create(final String name, final NodeType type,
            final INode parent, final Object payload)
            throws RegistryException {

        AttributeDescriptor.checkName(name);

        if (type == null)
            throw new IllegalArgumentException();

        final Node p = parent == null ? null : asNode(parent);

        final Node node = new Node(this, name, type, p, payload);

        // lock the container to be modified.
        final Object lock = p == null ? roots : p;

        synchronized (lock) {

            final Map<String, Node> container;

            if (p == null) {

                container = roots;

            } else {

                if (!p.isAcceptingChildren())
                    throw new NodeDestroyedException(p.getPath());

                container = p.children;

            }

            if (container.containsKey(name))
                throw new DuplicateNodeException(node.getPath());

            container.put(name, node);

            try {

                renderer.publish(node, type.getAttributeNames());

            } catch (PublishFailedException ex) {

                rollback(container, node);

                throw ex;

            } catch (RuntimeException ex) {

                rollback(container, node);

                throw new PublishFailedException(node.getPath(), ex);

            }

        }

        if (log.isInfoEnabled())
            log.info("Created: " + node);

        if (notifyListeners) {

            try {

                listener.nodeAdded(node);

            } catch (RuntimeException ex) {

                log.warn("Listener: " + node.getPath(), ex);

            }

        }

        return node;

    }

    /**
     * Undo the linking of a node whose publication failed. The release
     * callback is NOT invoked since the node never became live.
     */
    private void rollback(final Map<String, Node> container, final Node node) {

        container.remove(node.getName(), node);

        log.warn("Publish failed, rolled back: " + node.getPath());

        node.abandon();

    }

    /**
     * Take an additional handle on a live node.
     * 
     * @throws NodeDestroyedException
     *             if the node is no longer live.
     */
    public void acquire(final INode node) {

        if (!tryAcquire(node))
            throw new NodeDestroyedException(node.getPath());

    }

    /**
     * Take an additional handle on the node iff it is still live.
     * 
     * @return <code>true</code> iff a handle was taken.
     */
    public boolean tryAcquire(final INode node) {

        return asNode(node).get();

    }

    /**
     * Drop a handle. The node is finalized when the last handle is dropped.
     * 
     * @throws NodeDestroyedException
     *             if no handle remains on the node.
     */
    public void release(final INode node) {

        final Node n = asNode(node);

        if (n.put()) {

            finalizeNode(n);

        }

    }

    /**
     * Drop the handle returned by
     * {@link #create(String, NodeType, INode, Object)}. The node is finalized
     * iff no other handle is held on it, otherwise finalization is deferred
     * until the last handle is dropped.
     * <p>
     * Note: Destroying a node with children does not destroy the children. They
     * are detached (they no longer have a parent) and remain live until their
     * own handles are dropped.
     * 
     * @throws NodeDestroyedException
     *             if no handle remains on the node.
     */
    public void destroy(final INode node) {

        release(node);

    }

    private void finalizeNode(final Node node) {

        final Node p = node.getParent();

        final List<Node> orphans = node.markDestroyed();

        if (!orphans.isEmpty() && log.isInfoEnabled())
            log.info("Detached " + orphans.size() + " children of "
                    + node.getPath());

        renderer.unpublish(node);

        if (p != null) {

            synchronized (p) {

                p.children.remove(node.getName(), node);

            }

            node.detach();

        } else {

            synchronized (roots) {

                roots.remove(node.getName(), node);

            }

        }

        try {

            node.getType().getRelease().release(node);

        } finally {

            node.clearPayload();

        }

        if (log.isInfoEnabled())
            log.info("Finalized: " + node.getName());

        if (notifyListeners) {

            try {

                listener.nodeRemoved(node);

            } catch (RuntimeException ex) {

                log.warn("Listener: " + node.getName(), ex);

            }

        }

    }

    /**
     * Create the declared root nodes in order. Either all of the declared roots
     * are created or, on the first failure, every root created so far is
     * destroyed again in reverse creation order and an
     * {@link InitFailedException} is thrown.
     * 
     * @param roots
     *            The declared roots.
     * 
     * @throws InitFailedException
     *             if a declared root could not be created.
     * @throws IllegalStateException
     *             if the registry was already initialized.
     */
    synchronized public void initialize(final List<RootDeclaration> roots)
            throws InitFailedException {

        if (roots == null)
            throw new IllegalArgumentException();

        if (initialized)
            throw new IllegalStateException("Already initialized: " + name);

        final List<INode> created = new ArrayList<INode>(roots.size());

        for (RootDeclaration decl : roots) {

            try {

                created.add(create(decl.getName(), decl.getType(),
                        null/* parent */, decl.getPayload()));

            } catch (Exception ex) {

                log.error("Could not create " + decl + " in " + name + ": "
                        + ex);

                final InitFailedException e = new InitFailedException(decl
                        .getName(), ex);

                for (Throwable t : destroyAll(created, true/* rollback */)) {

                    e.addSuppressed(t);

                }

                throw e;

            }

        }

        declared.addAll(created);

        initialized = true;

        if (log.isInfoEnabled())
            log.info("Initialized " + name + ": " + declared);

    }

    /**
     * Destroy the roots created by {@link #initialize(List)} in reverse
     * creation order. Other nodes must be destroyed by their owners.
     * <p>
     * Every root is destroyed even if destroying another one fails. The first
     * such failure is rethrown once all roots have been destroyed, with any
     * later failures attached as suppressed exceptions.
     * 
     * @throws IllegalStateException
     *             unless the registry was initialized and has not yet been
     *             torn down.
     */
    synchronized public void exit() {

        if (!initialized)
            throw new IllegalStateException("Not initialized: " + name);

        if (exited)
            throw new IllegalStateException("Already torn down: " + name);

        exited = true;

        final List<RuntimeException> errors = destroyAll(declared,
                false/* rollback */);

        declared.clear();

        if (log.isInfoEnabled())
            log.info("Torn down: " + name);

        if (!errors.isEmpty()) {

            final RuntimeException first = errors.get(0);

            for (int i = 1; i < errors.size(); i++) {

                first.addSuppressed(errors.get(i));

            }

            throw first;

        }

    }

    /**
     * Destroy the nodes in reverse order. A failure to destroy one node, e.g.,
     * a release callback which throws, does not stop the others from being
     * destroyed.
     * 
     * @param rollback
     *            <code>true</code> if the nodes are destroyed to undo a failed
     *            {@link #initialize(List)}.
     * 
     * @return The failures, in the order in which they occurred.
     */
    private List<RuntimeException> destroyAll(final List<INode> nodes,
            final boolean rollback) {

        final List<RuntimeException> errors = new ArrayList<RuntimeException>();

        for (int i = nodes.size() - 1; i >= 0; i--) {

            final INode node = nodes.get(i);

            if (rollback)
                log.warn("Rolling back: " + node.getPath());
            else if (log.isInfoEnabled())
                log.info("Tearing down: " + node.getPath());

            try {

                destroy(node);

            } catch (RuntimeException ex) {

                log.warn("Could not destroy " + node.getPath() + " in " + name,
                        ex);

                errors.add(ex);

            }

        }

        return errors;

    }

    /**
     * Return the root node with that name.
     * 
     * @return The root -or- <code>null</code> if there is no such root.
     */
    public INode getRoot(final String name) {

        if (name == null)
            throw new IllegalArgumentException();

        return roots.get(name);

    }

    /**
     * A snapshot of the root nodes in order by name.
     */
    public List<INode> getRoots() {

        final List<INode> a = new ArrayList<INode>(roots.values());

        Collections.sort(a, Node.NameComparator.INSTANCE);

        return a;

    }

    /**
     * Return the node described by the path. A leading
     * {@link INode#pathSeparator} is optional, e.g., both
     * <code>/devices/sda</code> and <code>devices/sda</code> identify the
     * same node.
     * 
     * @return The node -or- <code>null</code> if nothing exists for that
     *         path.
     * 
     * @throws IllegalArgumentException
     *             if the path is <code>null</code>, empty or contains an empty
     *             path component.
     */
    public INode lookup(String path) {

        if (path == null)
            throw new IllegalArgumentException();

        if (path.startsWith(INode.pathSeparator)) {

            // drop off the leading '/'
            path = path.substring(1);

        }

        if (path.length() == 0 || path.contains("//")
                || path.startsWith(INode.pathSeparator)
                || path.endsWith(INode.pathSeparator)) {

            /*
             * Empty path names are not allowed.
             */

            throw new IllegalArgumentException(path);

        }

        final String[] a = path.split(INode.pathSeparator);

        INode t = roots.get(a[0]);

        for (int i = 1; i < a.length && t != null; i++) {

            t = t.getChild(a[i]);

        }

        return t;

    }

    /**
     * Verify that the node belongs to this registry.
     */
    private Node asNode(final INode node) {

        if (node == null)
            throw new IllegalArgumentException();

        if (!(node instanceof Node) || ((Node) node).getRegistry() != this)
            throw new IllegalArgumentException("Not a node of " + name + ": "
                    + node);

        return (Node) node;

    }

    /**
     * A human readable representation of the nodes in the registry.
     */
    public String toString() {

        final StringBuilder sb = new StringBuilder();

        sb.append(getClass().getSimpleName() + "{name=" + name + "}");

        for (INode root : getRoots()) {

            toString(sb, root);

        }

        return sb.toString();

    }

    private void toString(final StringBuilder sb, final INode node) {

        sb.append("\n" + node.getPath() + " " + node.getType().getAttributeNames());

        for (INode child : node.getChildren()) {

            toString(sb, child);

        }

    }

}
