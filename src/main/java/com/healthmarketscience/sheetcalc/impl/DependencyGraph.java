/*
Copyright (c) 2024 James Ahlborn

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package com.healthmarketscience.sheetcalc.impl;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.healthmarketscience.sheetcalc.CellKey;

/**
 * Directed graph of the cells read by each formula cell.  Cells are interned
 * into an arena of integer node ids, edges are kept in both directions as
 * insertion ordered sets of node ids.  The graph never holds a cycle, an
 * edge set which would close one is rejected as a whole.
 *
 * @author James Ahlborn
 */
public class DependencyGraph
{
  private final Map<CellKey,Integer> _ids = new HashMap<CellKey,Integer>();
  private final List<Node> _nodes = new ArrayList<Node>();
  private final Set<CellKey> _circular = new HashSet<CellKey>();

  public DependencyGraph() {}

  /**
   * Replaces the precedents of the given cell.
   *
   * @return {@code false} if the new edges would create a cycle, in which
   *         case the cell is left without precedents and remembered as
   *         circular
   */
  public boolean setDependencies(CellKey cell, Collection<CellKey> precedents)
  {
    int id = intern(cell);
    clearPrecedents(id);
    _circular.remove(cell);

    for(CellKey precKey : precedents) {
      int precId = intern(precKey);
      _nodes.get(id)._precedents.add(precId);
      _nodes.get(precId)._dependents.add(id);
    }

    if(isOnCycle(id)) {
      clearPrecedents(id);
      _circular.add(cell);
      return false;
    }
    return true;
  }

  public boolean isCircular(CellKey cell) {
    return _circular.contains(cell);
  }

  public Set<CellKey> getPrecedents(CellKey cell) {
    Integer id = _ids.get(cell);
    return ((id != null) ? toKeys(_nodes.get(id)._precedents) :
            Collections.<CellKey>emptySet());
  }

  public Set<CellKey> getDependents(CellKey cell) {
    Integer id = _ids.get(cell);
    return ((id != null) ? toKeys(_nodes.get(id)._dependents) :
            Collections.<CellKey>emptySet());
  }

  /**
   * Removes the given cell's own precedents.  Edges from formulas which
   * read the cell remain, the cell may still be read as a plain value.
   */
  public void removeCell(CellKey cell) {
    Integer id = _ids.get(cell);
    if(id != null) {
      clearPrecedents(id);
    }
    _circular.remove(cell);
  }

  /**
   * @return the number of cells known to the graph
   */
  public int size() {
    return _ids.size();
  }

  public void clear() {
    _ids.clear();
    _nodes.clear();
    _circular.clear();
  }

  /**
   * Determines the cells which need recalculation after the given cell
   * changed, ordered so that every cell comes after all of its
   * precedents.  The changed cell itself is not included.
   */
  public List<CellKey> getRecalcOrder(CellKey changed) {
    Integer startId = _ids.get(changed);
    if(startId == null) {
      return new ArrayList<CellKey>();
    }

    // collect everything downstream of the changed cell
    Set<Integer> affected = new LinkedHashSet<Integer>();
    Deque<Integer> queue = new ArrayDeque<Integer>();
    queue.add(startId);
    while(!queue.isEmpty()) {
      for(int depId : _nodes.get(queue.remove())._dependents) {
        if((depId != startId) && affected.add(depId)) {
          queue.add(depId);
        }
      }
    }

    // kahn's algorithm over the affected sub graph, ties keep discovery
    // order
    Map<Integer,Integer> inDegree = new HashMap<Integer,Integer>();
    for(int id : affected) {
      int degree = 0;
      for(int precId : _nodes.get(id)._precedents) {
        if(affected.contains(precId)) {
          ++degree;
        }
      }
      inDegree.put(id, degree);
    }

    List<CellKey> order = new ArrayList<CellKey>(affected.size());
    Set<Integer> done = new HashSet<Integer>();
    Deque<Integer> ready = new ArrayDeque<Integer>();
    for(int id : affected) {
      if(inDegree.get(id) == 0) {
        ready.add(id);
      }
    }
    while(!ready.isEmpty()) {
      int id = ready.remove();
      done.add(id);
      order.add(_nodes.get(id)._key);
      for(int depId : _nodes.get(id)._dependents) {
        if(affected.contains(depId)) {
          int degree = inDegree.get(depId) - 1;
          inDegree.put(depId, degree);
          if(degree == 0) {
            ready.add(depId);
          }
        }
      }
    }

    if(order.size() < affected.size()) {
      // only possible if a cycle slipped in, still visit everything once
      for(int id : affected) {
        if(!done.contains(id)) {
          order.add(_nodes.get(id)._key);
        }
      }
    }
    return order;
  }

  private int intern(CellKey cell) {
    Integer id = _ids.get(cell);
    if(id == null) {
      id = _nodes.size();
      _nodes.add(new Node(cell));
      _ids.put(cell, id);
    }
    return id;
  }

  private void clearPrecedents(int id) {
    Node node = _nodes.get(id);
    for(int precId : node._precedents) {
      _nodes.get(precId)._dependents.remove(id);
    }
    node._precedents.clear();
  }

  /**
   * @return {@code true} if the given node can reach itself by following
   *         precedent edges
   */
  private boolean isOnCycle(int startId) {
    Set<Integer> visited = new HashSet<Integer>();
    Deque<Integer> stack = new ArrayDeque<Integer>();
    stack.push(startId);
    while(!stack.isEmpty()) {
      int id = stack.pop();
      for(int precId : _nodes.get(id)._precedents) {
        if(precId == startId) {
          return true;
        }
        if(visited.add(precId)) {
          stack.push(precId);
        }
      }
    }
    return false;
  }

  private Set<CellKey> toKeys(Set<Integer> ids) {
    Set<CellKey> keys = new LinkedHashSet<CellKey>();
    for(int id : ids) {
      keys.add(_nodes.get(id)._key);
    }
    return keys;
  }

  private static final class Node
  {
    private final CellKey _key;
    private final Set<Integer> _precedents = new LinkedHashSet<Integer>();
    private final Set<Integer> _dependents = new LinkedHashSet<Integer>();

    private Node(CellKey key) {
      _key = key;
    }
  }
}
