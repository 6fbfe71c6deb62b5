/**
 * chronoqube: Time-aligned table views over heterogeneous data streams.
 *
 * Copyright (C) 2026 The chronoqube authors
 *
 * This file is part of chronoqube.
 *
 * chronoqube is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.chronoqube.execution;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.chronoqube.context.AutoInstatiate;
import org.chronoqube.context.InjectOptional;
import org.chronoqube.execution.listener.TableListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

/**
 * All tables, built or announced, are registered here by their id.
 * 
 * <p>
 * A table is first created with its metadata and later its {@link TableView} is stored.
 *
 * @author The chronoqube authors
 */
@AutoInstatiate
public class TableRegistry {
  private static final Logger logger = LoggerFactory.getLogger(TableRegistry.class);

  private Map<String, TableInfo> infos = new LinkedHashMap<>();
  private Map<String, TableView> builtTables = new LinkedHashMap<>();

  @InjectOptional
  private List<TableListener> tableListeners;

  /**
   * @return <code>false</code> if a table with that id exists already, in which case nothing is changed.
   */
  public synchronized boolean createTable(String id, String name, String description) {
    if (infos.containsKey(id))
      return false;
    infos.put(id, new TableInfo(id, name, description, ImmutableList.of(), ImmutableList.of()));
    logger.debug("Created table '{}'", id);
    return true;
  }

  /**
   * @throws IllegalStateException
   *           if there is no table with that id.
   */
  public synchronized void updateTableInfo(String id, String name, String description, List<String> tags)
      throws IllegalStateException {
    TableInfo old = infos.get(id);
    if (old == null)
      throw new IllegalStateException("Table '" + id + "' does not exist.");
    infos.put(id, new TableInfo(id, name, description, tags, old.getColumnNames()));
  }

  /**
   * @throws IllegalStateException
   *           if there is no table with that id.
   */
  public synchronized void storeBuiltTable(String id, TableView table) throws IllegalStateException {
    TableInfo info = infos.get(id);
    if (info == null)
      throw new IllegalStateException("Table '" + id + "' does not exist.");
    builtTables.put(id, table);
    infos.put(id, info.withColumnNames(table.getColumnNames()));
    logger.info("Stored table '{}' with {} rows and {} columns", id, table.getRowCount(), table.getColumnCount());

    if (tableListeners != null)
      tableListeners.forEach(l -> l.tableStored(id));
  }

  /**
   * @return <code>null</code> if there is no such table or it was not built yet.
   */
  public synchronized TableView getBuiltTable(String id) {
    return builtTables.get(id);
  }

  public synchronized TableInfo getTableInfo(String id) {
    return infos.get(id);
  }

  public synchronized boolean hasTable(String id) {
    return infos.containsKey(id);
  }

  /**
   * @return <code>true</code> if the table existed.
   */
  public synchronized boolean removeTable(String id) {
    if (infos.remove(id) == null)
      return false;
    builtTables.remove(id);
    logger.debug("Removed table '{}'", id);

    if (tableListeners != null)
      tableListeners.forEach(l -> l.tableRemoved(id));
    return true;
  }

  public synchronized Collection<String> getAllTableIds() {
    return new ArrayList<>(infos.keySet());
  }

  /**
   * @return The given base id if it is not taken, otherwise <code>base_N</code> with the smallest N >= 1 not taken.
   */
  public synchronized String generateUniqueTableId(String base) {
    if (!infos.containsKey(base))
      return base;
    int i = 1;
    while (infos.containsKey(base + "_" + i))
      i++;
    return base + "_" + i;
  }

  /* package */ void setTableListeners(List<TableListener> tableListeners) {
    this.tableListeners = tableListeners;
  }
}
