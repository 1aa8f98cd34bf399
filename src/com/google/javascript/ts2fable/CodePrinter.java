/*
 * Copyright 2017 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.javascript.ts2fable;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.javascript.ts2fable.ir.FsAlias;
import com.google.javascript.ts2fable.ir.FsArray;
import com.google.javascript.ts2fable.ir.FsEnum;
import com.google.javascript.ts2fable.ir.FsFile;
import com.google.javascript.ts2fable.ir.FsFunction;
import com.google.javascript.ts2fable.ir.FsGeneric;
import com.google.javascript.ts2fable.ir.FsImport;
import com.google.javascript.ts2fable.ir.FsInterface;
import com.google.javascript.ts2fable.ir.FsMapped;
import com.google.javascript.ts2fable.ir.FsModule;
import com.google.javascript.ts2fable.ir.FsParam;
import com.google.javascript.ts2fable.ir.FsProperty;
import com.google.javascript.ts2fable.ir.FsTuple;
import com.google.javascript.ts2fable.ir.FsType;
import com.google.javascript.ts2fable.ir.FsTypes;
import com.google.javascript.ts2fable.ir.FsUnion;
import com.google.javascript.ts2fable.ir.FsVariable;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * CodePrinter prints out F# binding code for a translated file.
 *
 * <p>The output is a recursive module named after the file namespace, its opens, and one nested
 * module per TypeScript namespace. Members are indented four spaces per level.
 */
public final class CodePrinter {

  private static final Logger logger = Logger.getLogger(CodePrinter.class.getName());

  static final DiagnosticType PARAM_ARRAY_NOT_ARRAY =
      DiagnosticType.error(
          "TS2FABLE_PARAM_ARRAY_NOT_ARRAY", "function with unsupported param array type: {0}");

  private static final String INDENT = "    ";
  private static final Joiner COMMA = Joiner.on(", ");

  private CodePrinter() {}

  /** Prints {@code file} as a list of lines without line terminators. */
  public static ImmutableList<String> print(FsFile file) {
    List<String> lines = new ArrayList<>();
    lines.add("module rec " + file.name());
    for (String open : file.opens()) {
      lines.add("open " + open);
    }
    for (FsModule module : file.modules()) {
      if (!module.types().isEmpty()) {
        printModule(lines, "", module);
      }
    }
    return ImmutableList.copyOf(lines);
  }

  private static void printModule(List<String> lines, String indent, FsModule module) {
    if (!module.isGlobal()) {
      lines.add("");
      lines.add(indent + "module " + module.name() + " =");
      indent = indent + INDENT;
    }
    for (FsType type : module.types()) {
      switch (type.getKind()) {
        case INTERFACE:
          printInterface(lines, indent, (FsInterface) type);
          break;
        case ENUM:
          printEnum(lines, indent, (FsEnum) type);
          break;
        case ALIAS:
          FsAlias al = (FsAlias) type;
          lines.add("");
          lines.add(
              indent + "type " + al.name() + printTypeParameters(al.typeParameters()) + " =");
          lines.add(indent + INDENT + printType(al.type()));
          break;
        case IMPORT:
          FsImport ip = (FsImport) type;
          lines.add("");
          lines.add(
              String.format(
                  "%slet [<Import(\"*\",\"%s\")>] %s: %s = jsNative",
                  indent, Joiner.on('.').join(ip.namespace()), ip.variable(), ip.type()));
          break;
        case MODULE:
          printModule(lines, indent, (FsModule) type);
          break;
        default:
          // Variables and functions are reachable through IExports.
          break;
      }
    }
  }

  private static void printInterface(List<String> lines, String indent, FsInterface it) {
    lines.add("");
    lines.add(
        indent
            + "type [<AllowNullLiteral>] "
            + it.name()
            + printTypeParameters(it.typeParameters())
            + " =");
    int count = 0;
    for (FsType inherited : it.inherits()) {
      lines.add(indent + INDENT + "inherit " + printType(inherited));
      count++;
    }
    for (FsType member : it.members()) {
      String line;
      if (member instanceof FsFunction fn && fn.name() != null) {
        line = printFunction(fn);
      } else if (member instanceof FsProperty pr) {
        line = printProperty(pr);
      } else {
        line = printType(member);
      }
      lines.add(indent + INDENT + line);
      count++;
    }
    if (count == 0) {
      lines.add(indent + INDENT + "interface end");
    }
  }

  private static void printEnum(List<String> lines, String indent, FsEnum en) {
    lines.add("");
    switch (en.type()) {
      case NUMERIC:
        lines.add(indent + "type [<RequireQualifiedAccess>] " + en.name() + " =");
        for (FsEnum.Case c : en.cases()) {
          String value = c.value() == null ? "" : " = " + c.value();
          lines.add(indent + INDENT + printEnumCase(c.name()) + value);
        }
        break;
      case STRING:
        lines.add(
            indent + "type [<StringEnum>] [<RequireQualifiedAccess>] " + en.name() + " =");
        for (FsEnum.Case c : en.cases()) {
          lines.add(indent + INDENT + printEnumCase(c.name()));
        }
        break;
      case UNKNOWN:
        lines.add(indent + "type " + en.name() + " =");
        lines.add(indent + INDENT + "obj");
        break;
    }
  }

  private static String printEnumCase(String name) {
    String normalized = EnumNames.normalize(name);
    if (normalized.equals(name)) {
      return "| " + name;
    }
    return "| [<CompiledName \"" + name + "\">] " + normalized;
  }

  /** Prints {@code <A, B>}, or nothing when there are no type parameters. */
  static String printTypeParameters(List<FsType> typeParameters) {
    if (typeParameters.isEmpty()) {
      return "";
    }
    return "<" + COMMA.join(printTypes(typeParameters)) + ">";
  }

  /** Prints a type as it appears in a signature. */
  static String printType(FsType type) {
    switch (type.getKind()) {
      case MAPPED:
        return ((FsMapped) type).name();
      case TODO:
        return "TODO";
      case ARRAY:
        return "ResizeArray<" + printType(((FsArray) type).elementType()) + ">";
      case UNION:
        FsUnion un = (FsUnion) type;
        String option = un.option() ? " option" : "";
        if (un.types().isEmpty()) {
          return printType(FsTypes.OBJ) + option;
        }
        if (un.types().size() == 1) {
          return printType(un.types().get(0)) + option;
        }
        return "U" + un.types().size() + "<" + COMMA.join(printTypes(un.types())) + ">" + option;
      case GENERIC:
        FsGeneric gn = (FsGeneric) type;
        return printType(gn.type()) + printTypeParameters(gn.typeParameters());
      case FUNCTION:
        FsFunction fn = (FsFunction) type;
        List<String> types = new ArrayList<>();
        if (fn.params().isEmpty()) {
          types.add(printType(FsTypes.UNIT));
        } else {
          fn.params().forEach(p -> types.add(printType(p.type())));
        }
        types.add(printType(fn.returnType()));
        return "(" + Joiner.on(" -> ").join(types) + ")";
      case TUPLE:
        return Joiner.on(" * ").join(printTypes(((FsTuple) type).types()));
      case VARIABLE:
        FsVariable vb = (FsVariable) type;
        return "abstract " + vb.name() + ": " + printType(vb.type()) + " with get, set";
      case STRING_LITERAL:
        return "string";
      default:
        logger.warning("unsupported printType " + type);
        return "TODO";
    }
  }

  /**
   * Prints an abstract member for {@code fn}, with its emit attribute if any, for example {@code
   * abstract add: a: float * ?b: float -> float}.
   *
   * @throws TranslationException if a rest parameter is not an array
   */
  static String printFunction(FsFunction fn) {
    StringBuilder line = new StringBuilder();
    if (fn.emit() != null) {
      line.append("[<Emit \"").append(fn.emit()).append("\">] ");
    }
    line.append("abstract ").append(fn.name());
    ImmutableList<String> params =
        fn.params().stream().map(p -> printParam(fn, p)).collect(toImmutableList());
    if (params.isEmpty()) {
      line.append(": unit");
    } else {
      line.append(": ").append(Joiner.on(" * ").join(params));
    }
    line.append(" -> ").append(printType(fn.returnType()));
    return line.toString();
  }

  private static String printParam(FsFunction fn, FsParam param) {
    String optional = param.optional() ? "?" : "";
    if (!param.paramArray()) {
      return optional + param.name() + ": " + printType(param.type());
    }
    if (!(param.type() instanceof FsArray array)) {
      throw new TranslationException(
          TranslationError.make(PARAM_ARRAY_NOT_ARRAY, String.valueOf(fn.name())));
    }
    return "[<ParamArray>] " + optional + param.name() + ": " + printType(array.elementType());
  }

  static String printProperty(FsProperty pr) {
    StringBuilder line = new StringBuilder();
    if (pr.emit() != null) {
      line.append("[<Emit \"").append(pr.emit()).append("\">] ");
    }
    line.append("abstract ").append(pr.name()).append(": ");
    FsParam index = pr.index();
    if (index != null) {
      line.append(index.name()).append(": ").append(printType(index.type())).append(" -> ");
    }
    line.append(printType(pr.type()));
    if (pr.option()) {
      line.append(" option");
    }
    return line.append(" with get, set").toString();
  }

  private static ImmutableList<String> printTypes(List<FsType> types) {
    return types.stream().map(CodePrinter::printType).collect(toImmutableList());
  }
}
