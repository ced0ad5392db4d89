package org.pyjs.compiler.runtime;

/**
 * Type tests, truthiness and keyword-argument plumbing shared by every other helper group.
 */
final class CoreHelpers {

    private CoreHelpers() {
    }

    static void register(RuntimeLibrary.Registry registry) {
        registry.function("_pyfunc_truthy", """
                function _pyfunc_truthy(v) {
                    if (v === null || v === undefined) {
                        return false;
                    }
                    if (typeof v !== "object") {
                        return !!v;
                    }
                    if (Array.isArray(v)) {
                        return v.length > 0;
                    }
                    if (typeof v.__bool__ === "function") {
                        return !!v.__bool__();
                    }
                    if (typeof v.__len__ === "function") {
                        return v.__len__() > 0;
                    }
                    if (_pyfunc_op_isdict(v)) {
                        return Object.keys(v).length > 0;
                    }
                    return true;
                }
                """);
        registry.function("_pyfunc_op_isdict", """
                function _pyfunc_op_isdict(v) {
                    var proto;
                    if (v === null || typeof v !== "object" || Array.isArray(v)) {
                        return false;
                    }
                    proto = Object.getPrototypeOf(v);
                    return proto === Object.prototype || proto === null;
                }
                """);
        registry.function("_pyfunc_op_isnumber", """
                function _pyfunc_op_isnumber(v) {
                    return typeof v === "number" || typeof v === "boolean";
                }
                """);
        registry.function("_pyfunc_op_typename", """
                function _pyfunc_op_typename(v) {
                    if (v === null || v === undefined) {
                        return "NoneType";
                    }
                    if (typeof v === "boolean") {
                        return "bool";
                    }
                    if (typeof v === "number") {
                        return v % 1 === 0 ? "int" : "float";
                    }
                    if (typeof v === "string") {
                        return "str";
                    }
                    if (typeof v === "function") {
                        return v.__pybases__ ? "type" : "function";
                    }
                    if (Array.isArray(v)) {
                        return "list";
                    }
                    if (_pyfunc_op_isdict(v)) {
                        return "dict";
                    }
                    if (v.constructor && v.constructor.__name__) {
                        return v.constructor.__name__;
                    }
                    return "object";
                }
                """);
        registry.function("_pyfunc_op_hook", """
                function _pyfunc_op_hook(v, name) {
                    if (v !== null && typeof v === "object" && !Array.isArray(v) && typeof v[name] === "function") {
                        return v[name];
                    }
                    return null;
                }
                """);
        registry.function("_pyfunc_op_unbox", """
                function _pyfunc_op_unbox(v) {
                    return v instanceof String ? String(v) : v;
                }
                """);
        registry.function("_pyfunc_op_kwargs", """
                function _pyfunc_op_kwargs(values) {
                    this.kwargs = values;
                }
                """);
        registry.function("_pyfunc_op_popkw", """
                function _pyfunc_op_popkw(args) {
                    var list = Array.prototype.slice.call(args);
                    if (list.length && list[list.length - 1] instanceof _pyfunc_op_kwargs) {
                        return [list, list.pop().kwargs];
                    }
                    return [list, {}];
                }
                """);
        registry.function("_pyfunc_op_kwmerge", """
                function _pyfunc_op_kwmerge() {
                    var result = {}, i, key, part;
                    for (i = 0; i < arguments.length; i++) {
                        part = arguments[i];
                        if (!_pyfunc_op_isdict(part)) {
                            throw _pyexc_TypeError("argument after ** must be a mapping, not " + _pyfunc_op_typename(part));
                        }
                        for (key in part) {
                            if (Object.prototype.hasOwnProperty.call(part, key)) {
                                if (Object.prototype.hasOwnProperty.call(result, key)) {
                                    throw _pyexc_TypeError("got multiple values for keyword argument '" + key + "'");
                                }
                                result[key] = part[key];
                            }
                        }
                    }
                    return result;
                }
                """);
        registry.function("_pyfunc_op_method", """
                function _pyfunc_op_method(obj, name) {
                    var method = obj === null || obj === undefined ? undefined : obj[name];
                    if (typeof method !== "function") {
                        throw _pyexc_AttributeError("'" + _pyfunc_op_typename(obj) + "' object has no attribute '" + name + "'");
                    }
                    return method;
                }
                """);
    }
}
