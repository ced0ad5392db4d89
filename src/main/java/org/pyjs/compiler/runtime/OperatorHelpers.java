package org.pyjs.compiler.runtime;

/**
 * Operators whose semantics differ from the native JavaScript ones: arithmetic on sequences,
 * equality, ordering, membership and identity. Objects may override them through dunder methods.
 */
final class OperatorHelpers {

    private OperatorHelpers() {
    }

    static void register(RuntimeLibrary.Registry registry) {
        registry.function("_pyfunc_op_add", """
                function _pyfunc_op_add(a, b) {
                    var hook = _pyfunc_op_hook(a, "__add__");
                    if (hook) {
                        return hook.call(a, b);
                    }
                    hook = _pyfunc_op_hook(b, "__radd__");
                    if (hook) {
                        return hook.call(b, a);
                    }
                    if (Array.isArray(a) && Array.isArray(b)) {
                        return a.concat(b);
                    }
                    if (typeof a === "string" && typeof b === "string") {
                        return a + b;
                    }
                    if (_pyfunc_op_isnumber(a) && _pyfunc_op_isnumber(b)) {
                        return a + b;
                    }
                    throw _pyexc_TypeError("unsupported operand type(s) for +: '" + _pyfunc_op_typename(a) + "' and '" + _pyfunc_op_typename(b) + "'");
                }
                """);
        registry.function("_pyfunc_op_iadd", """
                function _pyfunc_op_iadd(a, b) {
                    var hook = _pyfunc_op_hook(a, "__iadd__");
                    if (hook) {
                        return hook.call(a, b);
                    }
                    if (Array.isArray(a)) {
                        a.push.apply(a, _pyfunc_iter(b));
                        return a;
                    }
                    return _pyfunc_op_add(a, b);
                }
                """);
        registry.function("_pyfunc_op_mult", """
                function _pyfunc_op_mult(a, b) {
                    var hook = _pyfunc_op_hook(a, "__mul__"), seq, n, result, i;
                    if (hook) {
                        return hook.call(a, b);
                    }
                    if (_pyfunc_op_isnumber(a) && _pyfunc_op_isnumber(b)) {
                        return a * b;
                    }
                    if (_pyfunc_op_isnumber(a)) {
                        seq = b;
                        n = a;
                    } else {
                        seq = a;
                        n = b;
                    }
                    if ((typeof seq === "string" || Array.isArray(seq)) && _pyfunc_op_isnumber(n) && n % 1 === 0) {
                        result = typeof seq === "string" ? "" : [];
                        for (i = 0; i < n; i++) {
                            result = result.concat(seq);
                        }
                        return result;
                    }
                    throw _pyexc_TypeError("unsupported operand type(s) for *: '" + _pyfunc_op_typename(a) + "' and '" + _pyfunc_op_typename(b) + "'");
                }
                """);
        registry.function("_pyfunc_op_mod", """
                function _pyfunc_op_mod(a, b) {
                    var hook = _pyfunc_op_hook(a, "__mod__"), r;
                    if (hook) {
                        return hook.call(a, b);
                    }
                    if (typeof a === "string") {
                        return _pyfunc_op_percent(a, b);
                    }
                    if (_pyfunc_op_isnumber(a) && _pyfunc_op_isnumber(b)) {
                        if (+b === 0) {
                            throw _pyexc_ZeroDivisionError("integer division or modulo by zero");
                        }
                        r = a % b;
                        return r !== 0 && (r < 0) !== (b < 0) ? r + b : r;
                    }
                    throw _pyexc_TypeError("unsupported operand type(s) for %: '" + _pyfunc_op_typename(a) + "' and '" + _pyfunc_op_typename(b) + "'");
                }
                """);
        registry.function("_pyfunc_op_floordiv", """
                function _pyfunc_op_floordiv(a, b) {
                    var hook = _pyfunc_op_hook(a, "__floordiv__");
                    if (hook) {
                        return hook.call(a, b);
                    }
                    if (!_pyfunc_op_isnumber(a) || !_pyfunc_op_isnumber(b)) {
                        throw _pyexc_TypeError("unsupported operand type(s) for //: '" + _pyfunc_op_typename(a) + "' and '" + _pyfunc_op_typename(b) + "'");
                    }
                    if (+b === 0) {
                        throw _pyexc_ZeroDivisionError("integer division or modulo by zero");
                    }
                    return Math.floor(a / b);
                }
                """);
        registry.function("_pyfunc_op_pow", """
                function _pyfunc_op_pow(a, b) {
                    var hook = _pyfunc_op_hook(a, "__pow__");
                    if (hook) {
                        return hook.call(a, b);
                    }
                    if (!_pyfunc_op_isnumber(a) || !_pyfunc_op_isnumber(b)) {
                        throw _pyexc_TypeError("unsupported operand type(s) for **: '" + _pyfunc_op_typename(a) + "' and '" + _pyfunc_op_typename(b) + "'");
                    }
                    return Math.pow(a, b);
                }
                """);
        registry.function("_pyfunc_op_sub", """
                function _pyfunc_op_sub(a, b) {
                    var hook = _pyfunc_op_hook(a, "__sub__");
                    if (hook) {
                        return hook.call(a, b);
                    }
                    hook = _pyfunc_op_hook(b, "__rsub__");
                    if (hook) {
                        return hook.call(b, a);
                    }
                    if (_pyfunc_op_isnumber(a) && _pyfunc_op_isnumber(b)) {
                        return a - b;
                    }
                    if (Array.isArray(a) && Array.isArray(b)) {
                        return _pyfunc_op_setop(a, b, true, false, false);
                    }
                    throw _pyexc_TypeError("unsupported operand type(s) for -: '" + _pyfunc_op_typename(a) + "' and '" + _pyfunc_op_typename(b) + "'");
                }
                """);
        registry.function("_pyfunc_op_truediv", """
                function _pyfunc_op_truediv(a, b) {
                    var hook = _pyfunc_op_hook(a, "__truediv__");
                    if (hook) {
                        return hook.call(a, b);
                    }
                    if (!_pyfunc_op_isnumber(a) || !_pyfunc_op_isnumber(b)) {
                        throw _pyexc_TypeError("unsupported operand type(s) for /: '" + _pyfunc_op_typename(a) + "' and '" + _pyfunc_op_typename(b) + "'");
                    }
                    if (+b === 0) {
                        throw _pyexc_ZeroDivisionError("division by zero");
                    }
                    return a / b;
                }
                """);
        // sets are arrays, so an array operand of & | ^ - takes set semantics
        registry.function("_pyfunc_op_setop", """
                function _pyfunc_op_setop(a, b, left, both, right) {
                    var result = [], i;
                    for (i = 0; i < a.length; i++) {
                        if (_pyfunc_op_contains(b, a[i]) ? both : left) {
                            if (!_pyfunc_op_contains(result, a[i])) {
                                result.push(a[i]);
                            }
                        }
                    }
                    for (i = 0; right && i < b.length; i++) {
                        if (!_pyfunc_op_contains(a, b[i]) && !_pyfunc_op_contains(result, b[i])) {
                            result.push(b[i]);
                        }
                    }
                    return result;
                }
                """);
        registry.function("_pyfunc_op_bitwise", """
                function _pyfunc_op_bitwise(a, b, symbol, dunder, f) {
                    var hook = _pyfunc_op_hook(a, dunder), hi1, hi2, lo1, lo2;
                    if (hook) {
                        return hook.call(a, b);
                    }
                    if (_pyfunc_op_isnumber(a) && _pyfunc_op_isnumber(b) && a % 1 === 0 && b % 1 === 0) {
                        if (typeof a === "boolean" && typeof b === "boolean") {
                            return f(+a, +b) !== 0;
                        }
                        hi1 = Math.floor(a / 4294967296);
                        hi2 = Math.floor(b / 4294967296);
                        lo1 = a - hi1 * 4294967296;
                        lo2 = b - hi2 * 4294967296;
                        return f(hi1, hi2) * 4294967296 + (f(lo1, lo2) >>> 0);
                    }
                    if (Array.isArray(a) && Array.isArray(b)) {
                        if (symbol === "&") {
                            return _pyfunc_op_setop(a, b, false, true, false);
                        }
                        if (symbol === "|") {
                            return _pyfunc_op_setop(a, b, true, true, true);
                        }
                        return _pyfunc_op_setop(a, b, true, false, true);
                    }
                    throw _pyexc_TypeError("unsupported operand type(s) for " + symbol + ": '" + _pyfunc_op_typename(a) + "' and '" + _pyfunc_op_typename(b) + "'");
                }
                """);
        registry.function("_pyfunc_op_and", """
                function _pyfunc_op_and(a, b) {
                    return _pyfunc_op_bitwise(a, b, "&", "__and__", function (x, y) { return x & y; });
                }
                """);
        registry.function("_pyfunc_op_or", """
                function _pyfunc_op_or(a, b) {
                    return _pyfunc_op_bitwise(a, b, "|", "__or__", function (x, y) { return x | y; });
                }
                """);
        registry.function("_pyfunc_op_xor", """
                function _pyfunc_op_xor(a, b) {
                    return _pyfunc_op_bitwise(a, b, "^", "__xor__", function (x, y) { return x ^ y; });
                }
                """);
        registry.function("_pyfunc_op_shift", """
                function _pyfunc_op_shift(a, b, symbol, dunder) {
                    var hook = _pyfunc_op_hook(a, dunder);
                    if (hook) {
                        return hook.call(a, b);
                    }
                    if (!_pyfunc_op_isnumber(a) || !_pyfunc_op_isnumber(b) || a % 1 !== 0 || b % 1 !== 0) {
                        throw _pyexc_TypeError("unsupported operand type(s) for " + symbol + ": '" + _pyfunc_op_typename(a) + "' and '" + _pyfunc_op_typename(b) + "'");
                    }
                    if (b < 0) {
                        throw _pyexc_ValueError("negative shift count");
                    }
                    return symbol === "<<" ? a * Math.pow(2, b) : Math.floor(a / Math.pow(2, b));
                }
                """);
        registry.function("_pyfunc_op_lshift", """
                function _pyfunc_op_lshift(a, b) {
                    return _pyfunc_op_shift(a, b, "<<", "__lshift__");
                }
                """);
        registry.function("_pyfunc_op_rshift", """
                function _pyfunc_op_rshift(a, b) {
                    return _pyfunc_op_shift(a, b, ">>", "__rshift__");
                }
                """);
        registry.function("_pyfunc_op_neg", """
                function _pyfunc_op_neg(a) {
                    var hook = _pyfunc_op_hook(a, "__neg__");
                    if (hook) {
                        return hook.call(a);
                    }
                    if (!_pyfunc_op_isnumber(a)) {
                        throw _pyexc_TypeError("bad operand type for unary -: '" + _pyfunc_op_typename(a) + "'");
                    }
                    return -a;
                }
                """);
        registry.function("_pyfunc_op_pos", """
                function _pyfunc_op_pos(a) {
                    var hook = _pyfunc_op_hook(a, "__pos__");
                    if (hook) {
                        return hook.call(a);
                    }
                    if (!_pyfunc_op_isnumber(a)) {
                        throw _pyexc_TypeError("bad operand type for unary +: '" + _pyfunc_op_typename(a) + "'");
                    }
                    return +a;
                }
                """);
        registry.function("_pyfunc_op_invert", """
                function _pyfunc_op_invert(a) {
                    var hook = _pyfunc_op_hook(a, "__invert__");
                    if (hook) {
                        return hook.call(a);
                    }
                    if (!_pyfunc_op_isnumber(a) || a % 1 !== 0) {
                        throw _pyexc_TypeError("bad operand type for unary ~: '" + _pyfunc_op_typename(a) + "'");
                    }
                    return -a - 1;
                }
                """);
        registry.function("_pyfunc_op_equals", """
                function _pyfunc_op_equals(a, b) {
                    var hook, i, keys;
                    if (a === b) {
                        return true;
                    }
                    if (a === null || a === undefined || b === null || b === undefined) {
                        return a == b;
                    }
                    hook = _pyfunc_op_hook(a, "__eq__");
                    if (hook) {
                        return _pyfunc_truthy(hook.call(a, b));
                    }
                    hook = _pyfunc_op_hook(b, "__eq__");
                    if (hook) {
                        return _pyfunc_truthy(hook.call(b, a));
                    }
                    if (_pyfunc_op_isnumber(a) && _pyfunc_op_isnumber(b)) {
                        return +a === +b;
                    }
                    if (Array.isArray(a) && Array.isArray(b)) {
                        if (a.length !== b.length) {
                            return false;
                        }
                        for (i = 0; i < a.length; i++) {
                            if (!_pyfunc_op_equals(a[i], b[i])) {
                                return false;
                            }
                        }
                        return true;
                    }
                    if (_pyfunc_op_isdict(a) && _pyfunc_op_isdict(b)) {
                        keys = Object.keys(a);
                        if (keys.length !== Object.keys(b).length) {
                            return false;
                        }
                        for (i = 0; i < keys.length; i++) {
                            if (!Object.prototype.hasOwnProperty.call(b, keys[i]) || !_pyfunc_op_equals(a[keys[i]], b[keys[i]])) {
                                return false;
                            }
                        }
                        return true;
                    }
                    return false;
                }
                """);
        registry.function("_pyfunc_op_lt", """
                function _pyfunc_op_lt(a, b) {
                    var hook = _pyfunc_op_hook(a, "__lt__"), i, n;
                    if (hook) {
                        return hook.call(a, b);
                    }
                    hook = _pyfunc_op_hook(b, "__gt__");
                    if (hook) {
                        return hook.call(b, a);
                    }
                    if ((_pyfunc_op_isnumber(a) && _pyfunc_op_isnumber(b)) || (typeof a === "string" && typeof b === "string")) {
                        return a < b;
                    }
                    if (Array.isArray(a) && Array.isArray(b)) {
                        n = Math.min(a.length, b.length);
                        for (i = 0; i < n; i++) {
                            if (!_pyfunc_op_equals(a[i], b[i])) {
                                return _pyfunc_op_lt(a[i], b[i]);
                            }
                        }
                        return a.length < b.length;
                    }
                    throw _pyexc_TypeError("'<' not supported between instances of '" + _pyfunc_op_typename(a) + "' and '" + _pyfunc_op_typename(b) + "'");
                }
                """);
        registry.function("_pyfunc_op_le", """
                function _pyfunc_op_le(a, b) {
                    var hook = _pyfunc_op_hook(a, "__le__");
                    if (hook) {
                        return hook.call(a, b);
                    }
                    if ((_pyfunc_op_isnumber(a) && _pyfunc_op_isnumber(b)) || (typeof a === "string" && typeof b === "string")) {
                        return a <= b;
                    }
                    return _pyfunc_op_lt(a, b) || _pyfunc_op_equals(a, b);
                }
                """);
        registry.function("_pyfunc_op_gt", """
                function _pyfunc_op_gt(a, b) {
                    var hook = _pyfunc_op_hook(a, "__gt__");
                    if (hook) {
                        return hook.call(a, b);
                    }
                    return _pyfunc_op_lt(b, a);
                }
                """);
        registry.function("_pyfunc_op_ge", """
                function _pyfunc_op_ge(a, b) {
                    var hook = _pyfunc_op_hook(a, "__ge__");
                    if (hook) {
                        return hook.call(a, b);
                    }
                    return _pyfunc_op_le(b, a);
                }
                """);
        registry.function("_pyfunc_op_contains", """
                function _pyfunc_op_contains(container, item) {
                    var hook, i;
                    if (typeof container === "string") {
                        if (typeof item !== "string") {
                            throw _pyexc_TypeError("'in <string>' requires string as left operand, not " + _pyfunc_op_typename(item));
                        }
                        return container.indexOf(item) >= 0;
                    }
                    if (Array.isArray(container)) {
                        for (i = 0; i < container.length; i++) {
                            if (_pyfunc_op_equals(container[i], item)) {
                                return true;
                            }
                        }
                        return false;
                    }
                    hook = _pyfunc_op_hook(container, "__contains__");
                    if (hook) {
                        return _pyfunc_truthy(hook.call(container, item));
                    }
                    if (_pyfunc_op_isdict(container)) {
                        return Object.prototype.hasOwnProperty.call(container, item);
                    }
                    return _pyfunc_op_contains(_pyfunc_iter(container), item);
                }
                """);
        registry.function("_pyfunc_op_is", """
                function _pyfunc_op_is(a, b) {
                    return a === b || (a == null && b == null) || (a !== a && b !== b);
                }
                """);
    }
}
