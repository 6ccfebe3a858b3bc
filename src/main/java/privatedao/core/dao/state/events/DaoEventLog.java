/*
 * This file is part of PrivateDAO.
 *
 * PrivateDAO is free software: you can redistribute it and/or modify it
 * under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or (at
 * your option) any later version.
 *
 * PrivateDAO is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
 * FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public
 * License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with PrivateDAO. If not, see <http://www.gnu.org/licenses/>.
 */

package privatedao.core.dao.state.events;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;

/**
 * Append only sink of all published events.
 */
@Slf4j
public class DaoEventLog {
    private final List<DaoEvent> events = new CopyOnWriteArrayList<>();
    private final List<DaoEventListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(DaoEventListener listener) {
        listeners.add(listener);
    }

    public void append(List<DaoEvent> newEvents) {
        newEvents.forEach(event -> {
            events.add(event);
            log.debug("Event published: {}", event);
            listeners.forEach(listener -> {
                // A failing listener must not hide the event from the others
                try {
                    listener.onEvent(event);
                } catch (RuntimeException e) {
                    log.error("Listener failed at event {}", event, e);
                }
            });
        });
    }

    public List<DaoEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public <T extends DaoEvent> List<T> getEvents(Class<T> eventClass) {
        return events.stream()
                .filter(eventClass::isInstance)
                .map(eventClass::cast)
                .collect(Collectors.toList());
    }
}
