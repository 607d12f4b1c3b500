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
package com.sysreg.dispatch;

import java.util.Arrays;
import java.util.Properties;

import org.apache.log4j.Logger;

import com.sysreg.attr.AttributeDescriptor;
import com.sysreg.attr.AttributeException;
import com.sysreg.attr.NotReadableException;
import com.sysreg.attr.NotWritableException;
import com.sysreg.config.Configuration;
import com.sysreg.config.IntegerValidator;
import com.sysreg.registry.INode;
import com.sysreg.registry.Registry;
import com.sysreg.render.AttributeRef;
import com.sysreg.render.PathNotFoundException;

/**
 * Routes read and write requests against attribute paths to the show and
 * store callbacks of the attribute.
 * <p>
 * A reference is held on the node for the duration of each request so that
 * the node can not be finalized while a callback is running against it. The
 * reference is dropped on every exit path, which may finalize the node if its
 * last other handle was dropped in the meantime. A failure of the release
 * callback during such a finalization is logged, and the request reports its
 * own outcome.
 * <p>
 * At most one callback is invoked per request and failures are never retried.
 * Callbacks are not serialized against each other.
 * 
 * @version $Id$
 */
public class Dispatcher {

    protected static final Logger log = Logger.getLogger(Dispatcher.class);

    /**
     * Options for the {@link Dispatcher}. They are resolved against the
     * properties of the {@link Registry} using the name of the registry as the
     * namespace.
     */
    public interface Options {

        /**
         * The maximum number of bytes returned by a read and accepted by a
         * write (default {@value #DEFAULT_BUFFER_SIZE}). A value produced by a
         * show callback which is longer is truncated. A longer value given to
         * a write is rejected without invoking the store callback.
         */
        String BUFFER_SIZE = Dispatcher.class.getName() + ".bufferSize";

        String DEFAULT_BUFFER_SIZE = "4096";

    }

    private final Registry registry;

    private final int bufferSize;

    /**
     * @param registry
     *            The registry whose renderer resolves the request paths.
     */
    public Dispatcher(final Registry registry) {

        if (registry == null)
            throw new IllegalArgumentException();

        this.registry = registry;

        final Properties properties = registry.getProperties();

        this.bufferSize = Configuration.getProperty(properties, registry
                .getName(), Options.BUFFER_SIZE, Options.DEFAULT_BUFFER_SIZE,
                IntegerValidator.GT_ZERO);

    }

    public int getBufferSize() {

        return bufferSize;

    }

    /**
     * Read an attribute.
     * 
     * @param path
     *            The path of the attribute, e.g., <code>info/num_devices</code>.
     * 
     * @return The value produced by the show callback (an empty array if the
     *         callback produced <code>null</code>).
     * 
     * @throws PathNotFoundException
     *             if the path does not identify an attribute of a live node.
     * @throws NotReadableException
     *             if the attribute does not declare a show callback.
     * @throws AttributeException
     *             if the show callback fails.
     */
    public byte[] onRead(final String path) throws AttributeException {

        final AttributeRef ref = registry.getRenderer().resolve(path);

        final INode node = ref.getNode();

        if (!registry.tryAcquire(node)) {

            // Lost a race with the finalization of the node.
            throw new PathNotFoundException(path);

        }

        try {

            final AttributeDescriptor a = ref.getAttribute();

            if (!a.isReadable())
                throw new NotReadableException(ref.getPath());

            if (log.isDebugEnabled())
                log.debug("show: " + ref.getPath());

            final byte[] value = a.show(node);

            if (value == null)
                return new byte[0];

            if (value.length > bufferSize) {

                log.warn("Truncated: " + ref.getPath() + ", length="
                        + value.length + ", bufferSize=" + bufferSize);

                return Arrays.copyOf(value, bufferSize);

            }

            return value;

        } finally {

            release(node);

        }

    }

    /**
     * Write an attribute.
     * 
     * @param path
     *            The path of the attribute.
     * @param value
     *            The value.
     * 
     * @throws PathNotFoundException
     *             if the path does not identify an attribute of a live node.
     * @throws NotWritableException
     *             if the attribute is read-only or does not declare a store
     *             callback.
     * @throws AttributeException
     *             if the value is longer than the buffer size or the store
     *             callback fails.
     */
    public void onWrite(final String path, final byte[] value)
            throws AttributeException {

        if (value == null)
            throw new IllegalArgumentException();

        final AttributeRef ref = registry.getRenderer().resolve(path);

        final INode node = ref.getNode();

        if (!registry.tryAcquire(node)) {

            throw new PathNotFoundException(path);

        }

        try {

            final AttributeDescriptor a = ref.getAttribute();

            if (!a.isWritable())
                throw new NotWritableException(ref.getPath());

            if (value.length > bufferSize)
                throw new AttributeException("Value too large: "
                        + ref.getPath() + ", length=" + value.length
                        + ", bufferSize=" + bufferSize);

            if (log.isDebugEnabled())
                log.debug("store: " + ref.getPath());

            a.store(node, value);

        } finally {

            release(node);

        }

    }

    /**
     * Drop the reference taken for a request. Dropping it may finalize the
     * node, in which case a failure of the release callback is logged and
     * does not replace the outcome of the request.
     */
    private void release(final INode node) {

        try {

            registry.release(node);

        } catch (RuntimeException ex) {

            log.warn("Release failed: " + node.getPath(), ex);

        }

    }

}
