/*
 * package-info.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of Ripple, a forward-only XML event reader.
 *
 * Ripple is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * Ripple is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with Ripple.  If not, see <http://www.gnu.org/licenses/>.
 */

/**
 * A forward-only XML event reader.
 *
 * <p>{@link org.bluezoo.ripple.EventReader} turns a document into a
 * sequence of lexical {@link org.bluezoo.ripple.Event}s without decoding
 * it. Payloads stay as bytes until {@link org.bluezoo.ripple.Event#decode()}
 * is called, which uses the encoding in effect for the document at that
 * time: UTF-8 by default, the encoding indicated by a byte order mark, or
 * the one named by the first XML declaration.
 *
 * <pre>
 * EventReader reader = EventReader.fromStream(in);
 * Event event;
 * while ((event = reader.next()).getType() != EventType.END_OF_FILE) {
 *     if (event.getType() == EventType.TEXT) {
 *         System.out.println(event.decodeAndUnescape());
 *     }
 * }
 * </pre>
 */
package org.bluezoo.ripple;
