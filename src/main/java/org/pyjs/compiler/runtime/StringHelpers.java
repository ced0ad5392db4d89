package org.pyjs.compiler.runtime;

/**
 * Text conversion and formatting: {@code str}, {@code repr}, format specifications, printf-style
 * {@code %} formatting and {@code print}.
 */
final class StringHelpers {

    private StringHelpers() {
    }

    static void register(RuntimeLibrary.Registry registry) {
        registry.function("_pyfunc_op_numstr", """
                function _pyfunc_op_numstr(v) {
                    if (v === Infinity) {
                        return "inf";
                    }
                    if (v === -Infinity) {
                        return "-inf";
                    }
                    if (v !== v) {
                        return "nan";
                    }
                    return String(v);
                }
                """);
        registry.function("_pyfunc_op_quote", """
                function _pyfunc_op_quote(s) {
                    var quote = s.indexOf("'") >= 0 && s.indexOf('"') < 0 ? '"' : "'", out = quote, i, c, code;
                    for (i = 0; i < s.length; i++) {
                        c = s.charAt(i);
                        code = s.charCodeAt(i);
                        if (c === "\\\\") {
                            out += "\\\\\\\\";
                        } else if (c === quote) {
                            out += "\\\\" + quote;
                        } else if (c === "\\n") {
                            out += "\\\\n";
                        } else if (c === "\\r") {
                            out += "\\\\r";
                        } else if (c === "\\t") {
                            out += "\\\\t";
                        } else if (code < 32 || code === 127) {
                            out += "\\\\x" + (code < 16 ? "0" : "") + code.toString(16);
                        } else {
                            out += c;
                        }
                    }
                    return out + quote;
                }
                """);
        registry.function("_pyfunc_repr", """
                function _pyfunc_repr(v) {
                    var parts = [], i, keys;
                    if (v === null || v === undefined) {
                        return "None";
                    }
                    if (v === true) {
                        return "True";
                    }
                    if (v === false) {
                        return "False";
                    }
                    if (typeof v === "number") {
                        return _pyfunc_op_numstr(v);
                    }
                    if (typeof v === "string") {
                        return _pyfunc_op_quote(v);
                    }
                    if (typeof v === "function") {
                        if (v.__pybases__) {
                            return "<class '" + v.__name__ + "'>";
                        }
                        return "<function " + (v.__name__ || v.name || "<anonymous>") + ">";
                    }
                    if (Array.isArray(v)) {
                        for (i = 0; i < v.length; i++) {
                            parts.push(_pyfunc_repr(v[i]));
                        }
                        return "[" + parts.join(", ") + "]";
                    }
                    if (_pyfunc_op_isdict(v)) {
                        keys = Object.keys(v);
                        for (i = 0; i < keys.length; i++) {
                            parts.push(_pyfunc_op_quote(keys[i]) + ": " + _pyfunc_repr(v[keys[i]]));
                        }
                        return "{" + parts.join(", ") + "}";
                    }
                    if (typeof v.__repr__ === "function") {
                        return v.__repr__();
                    }
                    if (v.constructor && v.constructor.__name__) {
                        return "<" + v.constructor.__name__ + " object>";
                    }
                    return String(v);
                }
                """);
        registry.function("_pyfunc_str", """
                function _pyfunc_str(v) {
                    if (arguments.length === 0) {
                        return "";
                    }
                    if (typeof v === "string") {
                        return v;
                    }
                    if (v !== null && typeof v === "object" && !Array.isArray(v) && !_pyfunc_op_isdict(v)) {
                        if (typeof v.__str__ === "function") {
                            return v.__str__();
                        }
                        if (typeof v.__repr__ === "function") {
                            return v.__repr__();
                        }
                    }
                    return _pyfunc_repr(v);
                }
                """);
        registry.function("_pyfunc_op_pad", """
                function _pyfunc_op_pad(signText, body, fill, align, width) {
                    var total = signText.length + body.length, padding = "", left, i;
                    if (width <= total) {
                        return signText + body;
                    }
                    for (i = 0; i < width - total; i++) {
                        padding += fill;
                    }
                    switch (align) {
                        case "<":
                            return signText + body + padding;
                        case "=":
                            return signText + padding + body;
                        case "^":
                            left = Math.floor(padding.length / 2);
                            return padding.substring(0, left) + signText + body + padding.substring(left);
                        default:
                            return padding + signText + body;
                    }
                }
                """);
        registry.function("_pyfunc_op_exponent", """
                function _pyfunc_op_exponent(n, precision) {
                    var parts = n.toExponential(precision).split("e"), exp = parts[1], digits = exp.replace(/^[+-]/, "");
                    return parts[0] + "e" + (exp.charAt(0) === "-" ? "-" : "+") + (digits.length < 2 ? "0" + digits : digits);
                }
                """);
        registry.function("_pyfunc_format", """
                function _pyfunc_format(value, spec) {
                    var m, fill, align, sign, alt, width, comma, precision, type, body, hook, negative, n, parts, signText;
                    spec = spec === undefined || spec === null ? "" : _pyfunc_str(spec);
                    hook = _pyfunc_op_hook(value, "__format__");
                    if (hook) {
                        return hook.call(value, spec);
                    }
                    if (spec === "") {
                        return _pyfunc_str(value);
                    }
                    m = /^(?:([\\s\\S])?([<>=^]))?([+\\- ])?(#)?(0)?(\\d+)?(,)?(?:\\.(\\d+))?([bcdeEfFgGnosxX%])?$/.exec(spec);
                    if (!m) {
                        throw _pyexc_ValueError("Invalid format specifier '" + spec + "'");
                    }
                    fill = m[1] || (m[5] && !m[2] ? "0" : " ");
                    align = m[2] || (m[5] ? "=" : (typeof value === "number" || typeof value === "boolean" ? ">" : "<"));
                    sign = m[3] || "-";
                    alt = !!m[4];
                    width = m[6] ? parseInt(m[6], 10) : 0;
                    comma = !!m[7];
                    precision = m[8] ? parseInt(m[8], 10) : null;
                    type = m[9] || "";
                    if (typeof value === "boolean" && type !== "" && type !== "s") {
                        value = +value;
                    }
                    negative = false;
                    if (type === "s" || (type === "" && typeof value !== "number")) {
                        body = _pyfunc_str(value);
                        if (precision !== null) {
                            body = body.substring(0, precision);
                        }
                    } else {
                        if (typeof value !== "number") {
                            throw _pyexc_ValueError("Unknown format code '" + type + "' for object of type '" + _pyfunc_op_typename(value) + "'");
                        }
                        negative = value < 0 || (value === 0 && 1 / value < 0);
                        n = Math.abs(value);
                        switch (type) {
                            case "d":
                            case "n":
                                if (n % 1 !== 0) {
                                    throw _pyexc_ValueError("Unknown format code '" + type + "' for object of type 'float'");
                                }
                                body = n.toFixed(0);
                                break;
                            case "f":
                            case "F":
                                body = n.toFixed(precision === null ? 6 : precision);
                                break;
                            case "e":
                            case "E":
                                body = _pyfunc_op_exponent(n, precision === null ? 6 : precision);
                                if (type === "E") {
                                    body = body.toUpperCase();
                                }
                                break;
                            case "%":
                                body = (n * 100).toFixed(precision === null ? 6 : precision) + "%";
                                break;
                            case "x":
                                body = (alt ? "0x" : "") + n.toString(16);
                                break;
                            case "X":
                                body = (alt ? "0X" : "") + n.toString(16).toUpperCase();
                                break;
                            case "o":
                                body = (alt ? "0o" : "") + n.toString(8);
                                break;
                            case "b":
                                body = (alt ? "0b" : "") + n.toString(2);
                                break;
                            case "c":
                                body = String.fromCharCode(n);
                                break;
                            default:
                                body = precision === null ? _pyfunc_op_numstr(n) : String(+n.toPrecision(precision === 0 ? 1 : precision));
                        }
                        if (comma) {
                            parts = body.split(".");
                            parts[0] = parts[0].replace(/\\B(?=(\\d{3})+(?!\\d))/g, ",");
                            body = parts.join(".");
                        }
                    }
                    signText = negative ? "-" : (sign === "+" ? "+" : (sign === " " ? " " : ""));
                    return _pyfunc_op_pad(signText, body, fill, align, width);
                }
                """);
        registry.function("_pyfunc_op_percent", """
                function _pyfunc_op_percent(fmt, args) {
                    var index = 0, named = _pyfunc_op_isdict(args), values = Array.isArray(args) ? args : [args], result;
                    result = fmt.replace(/%(\\(([^)]*)\\))?([-+ #0]*)(\\d+)?(?:\\.(\\d+))?([sriduxXoeEfFgGc%])/g,
                        function (match, group, key, flags, width, precision, type) {
                            var value, spec;
                            if (type === "%") {
                                return "%";
                            }
                            if (group) {
                                value = _pyfunc_op_getitem(args, key);
                            } else {
                                if (index >= values.length) {
                                    throw _pyexc_TypeError("not enough arguments for format string");
                                }
                                value = values[index++];
                            }
                            flags = flags || "";
                            if (type === "s" || type === "r") {
                                return _pyfunc_op_pad("", type === "s" ? _pyfunc_str(value) : _pyfunc_repr(value), " ",
                                    flags.indexOf("-") >= 0 ? "<" : ">", width ? +width : 0);
                            }
                            if (type === "i" || type === "u") {
                                type = "d";
                            }
                            if (type === "d") {
                                value = value < 0 ? Math.ceil(value) : Math.floor(value);
                            }
                            spec = (flags.indexOf("-") >= 0 ? "<" : "")
                                + (flags.indexOf("+") >= 0 ? "+" : (flags.indexOf(" ") >= 0 ? " " : ""))
                                + (flags.indexOf("#") >= 0 ? "#" : "")
                                + (flags.indexOf("0") >= 0 && flags.indexOf("-") < 0 ? "0" : "")
                                + (width || "") + (precision ? "." + precision : "") + type;
                            return _pyfunc_format(value, spec);
                        });
                    if (!named && index < values.length) {
                        throw _pyexc_TypeError("not all arguments converted during string formatting");
                    }
                    return result;
                }
                """);
        registry.function("_pyfunc_print", """
                function _pyfunc_print() {
                    var args = _pyfunc_op_popkw(arguments), parts = [], sep, end, text, i;
                    sep = args[1].sep === undefined || args[1].sep === null ? " " : args[1].sep;
                    end = args[1].end === undefined || args[1].end === null ? "\\n" : args[1].end;
                    for (i = 0; i < args[0].length; i++) {
                        parts.push(_pyfunc_str(args[0][i]));
                    }
                    text = parts.join(sep) + end;
                    console.log(text.charAt(text.length - 1) === "\\n" ? text.substring(0, text.length - 1) : text);
                    return null;
                }
                """);
    }
}
