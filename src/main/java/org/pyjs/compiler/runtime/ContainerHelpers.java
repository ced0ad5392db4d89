package org.pyjs.compiler.runtime;

/**
 * Subscripting, slicing and the container constructors. Lists and tuples are arrays, dicts are
 * plain objects and sets are duplicate-free arrays.
 */
final class ContainerHelpers {

    private ContainerHelpers() {
    }

    static void register(RuntimeLibrary.Registry registry) {
        registry.function("_pyfunc_op_index", """
                function _pyfunc_op_index(seq, index) {
                    var i = +index;
                    if ((typeof index !== "number" && typeof index !== "boolean") || i % 1 !== 0) {
                        throw _pyexc_TypeError(_pyfunc_op_typename(seq) + " indices must be integers, not " + _pyfunc_op_typename(index));
                    }
                    if (i < 0) {
                        i += seq.length;
                    }
                    if (i < 0 || i >= seq.length) {
                        throw _pyexc_IndexError(_pyfunc_op_typename(seq) + " index out of range");
                    }
                    return i;
                }
                """);
        registry.function("_pyfunc_op_getitem", """
                function _pyfunc_op_getitem(obj, key) {
                    var hook;
                    if (Array.isArray(obj)) {
                        return obj[_pyfunc_op_index(obj, key)];
                    }
                    if (typeof obj === "string") {
                        return obj.charAt(_pyfunc_op_index(obj, key));
                    }
                    hook = _pyfunc_op_hook(obj, "__getitem__");
                    if (hook) {
                        return hook.call(obj, key);
                    }
                    if (_pyfunc_op_isdict(obj)) {
                        if (!Object.prototype.hasOwnProperty.call(obj, key)) {
                            throw _pyexc_KeyError(key);
                        }
                        return obj[key];
                    }
                    if (obj === null || obj === undefined) {
                        throw _pyexc_TypeError("'NoneType' object is not subscriptable");
                    }
                    return obj[key];
                }
                """);
        registry.function("_pyfunc_op_setitem", """
                function _pyfunc_op_setitem(obj, key, value) {
                    var hook;
                    if (Array.isArray(obj)) {
                        obj[_pyfunc_op_index(obj, key)] = value;
                        return value;
                    }
                    hook = _pyfunc_op_hook(obj, "__setitem__");
                    if (hook) {
                        hook.call(obj, key, value);
                        return value;
                    }
                    if (obj === null || obj === undefined || typeof obj !== "object") {
                        throw _pyexc_TypeError("'" + _pyfunc_op_typename(obj) + "' object does not support item assignment");
                    }
                    obj[key] = value;
                    return value;
                }
                """);
        registry.function("_pyfunc_op_delitem", """
                function _pyfunc_op_delitem(obj, key) {
                    var hook;
                    if (Array.isArray(obj)) {
                        obj.splice(_pyfunc_op_index(obj, key), 1);
                        return null;
                    }
                    hook = _pyfunc_op_hook(obj, "__delitem__");
                    if (hook) {
                        hook.call(obj, key);
                        return null;
                    }
                    if (_pyfunc_op_isdict(obj)) {
                        if (!Object.prototype.hasOwnProperty.call(obj, key)) {
                            throw _pyexc_KeyError(key);
                        }
                        delete obj[key];
                        return null;
                    }
                    throw _pyexc_TypeError("'" + _pyfunc_op_typename(obj) + "' object does not support item deletion");
                }
                """);
        registry.function("_pyfunc_op_slicebound", """
                function _pyfunc_op_slicebound(value, n, step, isStart) {
                    if (value === null || value === undefined) {
                        if (step > 0) {
                            return isStart ? 0 : n;
                        }
                        return isStart ? n - 1 : -1;
                    }
                    if (value < 0) {
                        value += n;
                        if (value < 0) {
                            value = step > 0 ? 0 : -1;
                        }
                    } else if (value >= n) {
                        value = step > 0 ? n : n - 1;
                    }
                    return value;
                }
                """);
        registry.function("_pyfunc_op_slice", """
                function _pyfunc_op_slice(obj, start, stop, step) {
                    var n, result, i;
                    if (typeof obj !== "string" && !Array.isArray(obj)) {
                        throw _pyexc_TypeError("'" + _pyfunc_op_typename(obj) + "' object is not subscriptable");
                    }
                    n = obj.length;
                    step = step === null || step === undefined ? 1 : step;
                    if (step === 0) {
                        throw _pyexc_ValueError("slice step cannot be zero");
                    }
                    start = _pyfunc_op_slicebound(start, n, step, true);
                    stop = _pyfunc_op_slicebound(stop, n, step, false);
                    if (step === 1) {
                        return obj.slice(start, Math.max(start, stop));
                    }
                    result = [];
                    if (step > 0) {
                        for (i = start; i < stop; i += step) {
                            result.push(obj[i]);
                        }
                    } else {
                        for (i = start; i > stop; i += step) {
                            result.push(obj[i]);
                        }
                    }
                    return typeof obj === "string" ? result.join("") : result;
                }
                """);
        registry.function("_pyfunc_list", """
                function _pyfunc_list(iterable) {
                    return iterable === undefined ? [] : _pyfunc_iter(iterable).slice();
                }
                """);
        registry.function("_pyfunc_tuple", """
                function _pyfunc_tuple(iterable) {
                    return iterable === undefined ? [] : _pyfunc_iter(iterable).slice();
                }
                """);
        registry.function("_pyfunc_set", """
                function _pyfunc_set(iterable) {
                    var items = iterable === undefined ? [] : _pyfunc_iter(iterable), result = [], i;
                    for (i = 0; i < items.length; i++) {
                        if (!_pyfunc_op_contains(result, items[i])) {
                            result.push(items[i]);
                        }
                    }
                    return result;
                }
                """);
        registry.function("_pyfunc_dict", """
                function _pyfunc_dict() {
                    var args = _pyfunc_op_popkw(arguments), result = {}, source = args[0][0], items, pair, i, key;
                    if (source !== undefined && source !== null) {
                        if (_pyfunc_op_isdict(source)) {
                            for (key in source) {
                                if (Object.prototype.hasOwnProperty.call(source, key)) {
                                    result[key] = source[key];
                                }
                            }
                        } else {
                            items = _pyfunc_iter(source);
                            for (i = 0; i < items.length; i++) {
                                pair = _pyfunc_unpack(items[i], 2);
                                result[pair[0]] = pair[1];
                            }
                        }
                    }
                    for (key in args[1]) {
                        if (Object.prototype.hasOwnProperty.call(args[1], key)) {
                            result[key] = args[1][key];
                        }
                    }
                    return result;
                }
                """);
    }
}
