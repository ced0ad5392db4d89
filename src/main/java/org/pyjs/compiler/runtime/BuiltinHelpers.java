package org.pyjs.compiler.runtime;

/**
 * Conversion, reflection and numeric builtins.
 */
final class BuiltinHelpers {

    private BuiltinHelpers() {
    }

    static void register(RuntimeLibrary.Registry registry) {
        registry.function("_pyfunc_int", """
                function _pyfunc_int(x, base) {
                    var text, hook;
                    if (x === undefined) {
                        return 0;
                    }
                    if (typeof x === "string") {
                        base = base === undefined ? 10 : base;
                        text = x.trim().replace(/_/g, "");
                        if (base === 16) {
                            text = text.replace(/^([+-]?)0[xX]/, "$1");
                        }
                        if (!(base === 10 ? /^[+-]?\\d+$/ : /^[+-]?[0-9a-zA-Z]+$/).test(text) || isNaN(parseInt(text, base))) {
                            throw _pyexc_ValueError("invalid literal for int() with base " + base + ": " + _pyfunc_repr(x));
                        }
                        return parseInt(text, base);
                    }
                    if (typeof x === "boolean") {
                        return x ? 1 : 0;
                    }
                    if (typeof x === "number") {
                        if (!isFinite(x)) {
                            throw _pyexc_ValueError("cannot convert float " + _pyfunc_op_numstr(x) + " to integer");
                        }
                        return x < 0 ? Math.ceil(x) : Math.floor(x);
                    }
                    hook = _pyfunc_op_hook(x, "__int__");
                    if (hook) {
                        return hook.call(x);
                    }
                    throw _pyexc_TypeError("int() argument must be a string or a number, not '" + _pyfunc_op_typename(x) + "'");
                }
                """);
        registry.function("_pyfunc_float", """
                function _pyfunc_float(x) {
                    var text, hook;
                    if (x === undefined) {
                        return 0;
                    }
                    if (typeof x === "string") {
                        text = x.trim().toLowerCase();
                        if (text === "inf" || text === "+inf" || text === "infinity") {
                            return Infinity;
                        }
                        if (text === "-inf" || text === "-infinity") {
                            return -Infinity;
                        }
                        if (text === "nan") {
                            return NaN;
                        }
                        if (!/^[+-]?(\\d+\\.?\\d*|\\.\\d+)(e[+-]?\\d+)?$/.test(text)) {
                            throw _pyexc_ValueError("could not convert string to float: " + _pyfunc_repr(x));
                        }
                        return parseFloat(text);
                    }
                    if (_pyfunc_op_isnumber(x)) {
                        return +x;
                    }
                    hook = _pyfunc_op_hook(x, "__float__");
                    if (hook) {
                        return hook.call(x);
                    }
                    throw _pyexc_TypeError("float() argument must be a string or a number, not '" + _pyfunc_op_typename(x) + "'");
                }
                """);
        registry.function("_pyfunc_bool", """
                function _pyfunc_bool(x) {
                    return _pyfunc_truthy(x);
                }
                """);
        registry.function("_pyfunc_abs", """
                function _pyfunc_abs(x) {
                    var hook = _pyfunc_op_hook(x, "__abs__");
                    if (hook) {
                        return hook.call(x);
                    }
                    if (!_pyfunc_op_isnumber(x)) {
                        throw _pyexc_TypeError("bad operand type for abs(): '" + _pyfunc_op_typename(x) + "'");
                    }
                    return Math.abs(x);
                }
                """);
        registry.function("_pyfunc_round", """
                function _pyfunc_round(x, ndigits) {
                    var factor = Math.pow(10, ndigits || 0), scaled = x * factor, rounded = Math.round(scaled);
                    if (Math.abs(scaled % 1) === 0.5 && rounded % 2 !== 0) {
                        rounded -= 1;
                    }
                    return ndigits === undefined || ndigits === null ? rounded : rounded / factor;
                }
                """);
        registry.function("_pyfunc_chr", """
                function _pyfunc_chr(code) {
                    if (code > 0xFFFF && typeof String.fromCodePoint === "function") {
                        return String.fromCodePoint(code);
                    }
                    return String.fromCharCode(code);
                }
                """);
        registry.function("_pyfunc_ord", """
                function _pyfunc_ord(s) {
                    if (typeof s !== "string" || s.length !== 1) {
                        throw _pyexc_TypeError("ord() expected a character, but string of length " + _pyfunc_len(s) + " found");
                    }
                    return s.charCodeAt(0);
                }
                """);
        registry.function("_pyfunc_isinstance", """
                function _pyfunc_isinstance(obj, cls) {
                    var i;
                    if (Array.isArray(cls)) {
                        for (i = 0; i < cls.length; i++) {
                            if (_pyfunc_isinstance(obj, cls[i])) {
                                return true;
                            }
                        }
                        return false;
                    }
                    if (cls === Object) {
                        return true;
                    }
                    if (cls === _pyfunc_int) {
                        return (typeof obj === "number" && obj % 1 === 0) || typeof obj === "boolean";
                    }
                    if (cls === _pyfunc_float) {
                        return typeof obj === "number";
                    }
                    if (cls === _pyfunc_bool) {
                        return typeof obj === "boolean";
                    }
                    if (cls === _pyfunc_str) {
                        return typeof obj === "string";
                    }
                    if (cls === _pyfunc_list || cls === _pyfunc_tuple || cls === _pyfunc_set) {
                        return Array.isArray(obj);
                    }
                    if (cls === _pyfunc_dict) {
                        return _pyfunc_op_isdict(obj);
                    }
                    if (typeof cls !== "function") {
                        throw _pyexc_TypeError("isinstance() arg 2 must be a type or tuple of types");
                    }
                    if (obj === null || obj === undefined) {
                        return false;
                    }
                    return obj instanceof cls || (typeof obj === "object" && _pyfunc_op_issubclass(obj.constructor, cls));
                }
                """);
        registry.function("_pyfunc_hasattr", """
                function _pyfunc_hasattr(obj, name) {
                    return obj !== null && obj !== undefined && obj[name] !== undefined;
                }
                """);
        registry.function("_pyfunc_getattr", """
                function _pyfunc_getattr(obj, name, fallback) {
                    var value = obj === null || obj === undefined ? undefined : obj[name];
                    if (value === undefined) {
                        if (arguments.length > 2) {
                            return fallback;
                        }
                        throw _pyexc_AttributeError("'" + _pyfunc_op_typename(obj) + "' object has no attribute '" + name + "'");
                    }
                    return value;
                }
                """);
        registry.function("_pyfunc_setattr", """
                function _pyfunc_setattr(obj, name, value) {
                    obj[name] = value;
                    return null;
                }
                """);
        registry.function("_pyfunc_callable", """
                function _pyfunc_callable(x) {
                    return typeof x === "function";
                }
                """);
    }
}
