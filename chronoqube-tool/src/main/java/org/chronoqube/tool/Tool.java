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
package org.chronoqube.tool;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.reflect.ClassPath;
import com.google.common.reflect.ClassPath.ClassInfo;

/**
 * Main class of chronoqube tool, which provides command line functions for chronoqube.
 *
 * @author The chronoqube authors
 */
public class Tool implements ToolFunction {
  private static final String BASE_PKG = "org.chronoqube.tool";

  private static final Logger logger = LoggerFactory.getLogger(Tool.class);

  public static void main(String[] args) throws IOException, ReflectiveOperationException {
    new Tool(findToolFunctions()).execute(args);
  }

  /**
   * @return All classes in the tool package annotated with {@link ToolFunctionName}, by name.
   */
  /* package */ static Map<String, ToolFunction> findToolFunctions() throws IOException, ReflectiveOperationException {
    Collection<ClassInfo> classInfos =
        ClassPath.from(Tool.class.getClassLoader()).getTopLevelClassesRecursive(BASE_PKG);

    Map<String, ToolFunction> toolFunctions = new TreeMap<>();

    for (ClassInfo classInfo : classInfos) {
      Class<?> clazz = classInfo.load();
      ToolFunctionName toolFunctionName = clazz.getAnnotation(ToolFunctionName.class);
      if (toolFunctionName != null) {
        try {
          ToolFunction functionInstance = (ToolFunction) clazz.getDeclaredConstructor().newInstance();
          toolFunctions.put(toolFunctionName.value(), functionInstance);
        } catch (InvocationTargetException e) {
          throw new IllegalStateException("Could not instantiate tool function " + clazz.getName(), e);
        }
      }
    }
    return toolFunctions;
  }

  private Map<String, ToolFunction> toolFunctions;

  private Tool(Map<String, ToolFunction> toolFunctions) {
    this.toolFunctions = toolFunctions;
  }

  /**
   * @return One line per function: its name and description.
   */
  /* package */ static List<String> describe(Map<String, ToolFunction> toolFunctions) {
    List<String> res = new ArrayList<>();
    for (Entry<String, ToolFunction> e : toolFunctions.entrySet()) {
      String description = e.getValue().getClass().getAnnotation(ToolFunctionName.class).description();
      res.add(description.isEmpty() ? e.getKey() : e.getKey() + "\t" + description);
    }
    return res;
  }

  @Override
  public void execute(String[] args) {
    if (args.length == 0 || !toolFunctions.containsKey(args[0])) {
      logger.error("No function name given or function unknown.");
      System.out.println("Usage: Tool <function> [options], where function is one of:");
      for (String line : describe(toolFunctions))
        System.out.println("  " + line);
      System.out.println();
      System.out.println("Copyright (C) 2026 The chronoqube authors");
      System.out.println();
      System.out.println(
          "chronoqube is free software: you can redistribute it and/or modify it under the terms of the GNU Affero "
              + "General Public License as published by the Free Software Foundation, either version 3 of the License, "
              + "or (at your option) any later version. This program is distributed in the hope that it will be "
              + "useful, but WITHOUT ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS "
              + "FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more details.");
      System.exit(1);
      return;
    }

    String[] remainingArgs = new String[args.length - 1];
    System.arraycopy(args, 1, remainingArgs, 0, remainingArgs.length);

    toolFunctions.get(args[0]).execute(remainingArgs);
  }
}
