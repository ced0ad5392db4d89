package org.pyjs.compiler.runtime;

import java.util.List;

/**
 * The exception class hierarchy, raising, and matching of thrown values against except clauses.
 * Native TypeError, ReferenceError and RangeError match TypeError, NameError and ValueError,
 * except that a native TypeError from reading a member of None matches AttributeError.
 */
public final class ExceptionHelpers {

    /** The exception classes the runtime defines, base classes first. */
    public static final List<String> EXCEPTION_NAMES = List.of(
            "BaseException",
            "Exception",
            "ArithmeticError",
            "ZeroDivisionError",
            "LookupError",
            "IndexError",
            "KeyError",
            "ValueError",
            "TypeError",
            "AttributeError",
            "NameError",
            "UnboundLocalError",
            "RuntimeError",
            "NotImplementedError",
            "AssertionError",
            "StopIteration");

    private ExceptionHelpers() {
    }

    static void register(RuntimeLibrary.Registry registry) {
        registry.function("_pyfunc_op_raise", """
                function _pyfunc_op_raise(exc, cause) {
                    if (typeof exc === "function") {
                        exc = exc();
                    }
                    if (!(exc instanceof _pyexc_BaseException) && !(exc instanceof Error)) {
                        throw _pyexc_TypeError("exceptions must derive from BaseException");
                    }
                    if (cause !== undefined) {
                        if (typeof cause === "function") {
                            cause = cause();
                        }
                        exc.__cause__ = cause;
                    }
                    return exc;
                }
                """);
        registry.function("_pyfunc_op_errtype", """
                function _pyfunc_op_errtype(err) {
                    if (err instanceof _pyexc_BaseException) {
                        return err.constructor;
                    }
                    if (err instanceof TypeError) {
                        // reading a member of null or undefined
                        if (/\\b(?:of|from) (?:null|undefined)\\b|has no properties|Cannot read|Cannot set/.test(String(err.message))) {
                            return _pyexc_AttributeError;
                        }
                        return _pyexc_TypeError;
                    }
                    if (err instanceof ReferenceError) {
                        return _pyexc_NameError;
                    }
                    if (err instanceof RangeError) {
                        return _pyexc_ValueError;
                    }
                    return _pyexc_Exception;
                }
                """);
        registry.function("_pyfunc_op_matches", """
                function _pyfunc_op_matches(err, types) {
                    var i;
                    if (Array.isArray(types)) {
                        for (i = 0; i < types.length; i++) {
                            if (_pyfunc_op_matches(err, types[i])) {
                                return true;
                            }
                        }
                        return false;
                    }
                    if (typeof types !== "function") {
                        throw _pyexc_TypeError("catching classes that do not inherit from BaseException is not allowed");
                    }
                    if (err instanceof types) {
                        return true;
                    }
                    return _pyfunc_op_issubclass(_pyfunc_op_errtype(err), types);
                }
                """);
        registry.type("_pyexc_BaseException", """
                function _pyexc_BaseException() {
                    return _pyfunc_op_instantiate(_pyexc_BaseException, this, arguments);
                }
                _pyfunc_op_extends(_pyexc_BaseException, Error, "BaseException", []);
                _pyexc_BaseException.prototype.__init__ = function () {
                    var args = _pyfunc_op_popkw(arguments)[0];
                    this.args = args;
                    this.message = args.length === 0 ? "" : (args.length === 1 ? _pyfunc_str(args[0]) : _pyfunc_repr(args));
                };
                _pyexc_BaseException.prototype.__str__ = function () {
                    return this.message;
                };
                _pyexc_BaseException.prototype.__repr__ = function () {
                    var parts = [], i;
                    for (i = 0; i < this.args.length; i++) {
                        parts.push(_pyfunc_repr(this.args[i]));
                    }
                    return this.constructor.__name__ + "(" + parts.join(", ") + ")";
                };
                _pyexc_BaseException.prototype.toString = function () {
                    return this.constructor.__name__ + (this.message ? ": " + this.message : "");
                };
                """);
        registry.type("_pyexc_Exception", """
                function _pyexc_Exception() {
                    return _pyfunc_op_instantiate(_pyexc_Exception, this, arguments);
                }
                _pyfunc_op_extends(_pyexc_Exception, _pyexc_BaseException, "Exception", []);
                """);
        registry.type("_pyexc_ArithmeticError", """
                function _pyexc_ArithmeticError() {
                    return _pyfunc_op_instantiate(_pyexc_ArithmeticError, this, arguments);
                }
                _pyfunc_op_extends(_pyexc_ArithmeticError, _pyexc_Exception, "ArithmeticError", []);
                """);
        registry.type("_pyexc_ZeroDivisionError", """
                function _pyexc_ZeroDivisionError() {
                    return _pyfunc_op_instantiate(_pyexc_ZeroDivisionError, this, arguments);
                }
                _pyfunc_op_extends(_pyexc_ZeroDivisionError, _pyexc_ArithmeticError, "ZeroDivisionError", []);
                """);
        registry.type("_pyexc_LookupError", """
                function _pyexc_LookupError() {
                    return _pyfunc_op_instantiate(_pyexc_LookupError, this, arguments);
                }
                _pyfunc_op_extends(_pyexc_LookupError, _pyexc_Exception, "LookupError", []);
                """);
        registry.type("_pyexc_IndexError", """
                function _pyexc_IndexError() {
                    return _pyfunc_op_instantiate(_pyexc_IndexError, this, arguments);
                }
                _pyfunc_op_extends(_pyexc_IndexError, _pyexc_LookupError, "IndexError", []);
                """);
        registry.type("_pyexc_KeyError", """
                function _pyexc_KeyError() {
                    return _pyfunc_op_instantiate(_pyexc_KeyError, this, arguments);
                }
                _pyfunc_op_extends(_pyexc_KeyError, _pyexc_LookupError, "KeyError", []);
                _pyexc_KeyError.prototype.__str__ = function () {
                    return this.args.length === 1 ? _pyfunc_repr(this.args[0]) : this.message;
                };
                """);
        registry.type("_pyexc_ValueError", """
                function _pyexc_ValueError() {
                    return _pyfunc_op_instantiate(_pyexc_ValueError, this, arguments);
                }
                _pyfunc_op_extends(_pyexc_ValueError, _pyexc_Exception, "ValueError", []);
                """);
        registry.type("_pyexc_TypeError", """
                function _pyexc_TypeError() {
                    return _pyfunc_op_instantiate(_pyexc_TypeError, this, arguments);
                }
                _pyfunc_op_extends(_pyexc_TypeError, _pyexc_Exception, "TypeError", []);
                """);
        registry.type("_pyexc_AttributeError", """
                function _pyexc_AttributeError() {
                    return _pyfunc_op_instantiate(_pyexc_AttributeError, this, arguments);
                }
                _pyfunc_op_extends(_pyexc_AttributeError, _pyexc_Exception, "AttributeError", []);
                """);
        registry.type("_pyexc_NameError", """
                function _pyexc_NameError() {
                    return _pyfunc_op_instantiate(_pyexc_NameError, this, arguments);
                }
                _pyfunc_op_extends(_pyexc_NameError, _pyexc_Exception, "NameError", []);
                """);
        registry.type("_pyexc_UnboundLocalError", """
                function _pyexc_UnboundLocalError() {
                    return _pyfunc_op_instantiate(_pyexc_UnboundLocalError, this, arguments);
                }
                _pyfunc_op_extends(_pyexc_UnboundLocalError, _pyexc_NameError, "UnboundLocalError", []);
                """);
        registry.function("_pyfunc_op_unbound", """
                function _pyfunc_op_unbound() {
                }
                """);
        registry.function("_pyfunc_op_local", """
                function _pyfunc_op_local(value, name) {
                    if (value === _pyfunc_op_unbound) {
                        throw _pyexc_UnboundLocalError("local variable '" + name + "' referenced before assignment");
                    }
                    return value;
                }
                """);
        registry.type("_pyexc_RuntimeError", """
                function _pyexc_RuntimeError() {
                    return _pyfunc_op_instantiate(_pyexc_RuntimeError, this, arguments);
                }
                _pyfunc_op_extends(_pyexc_RuntimeError, _pyexc_Exception, "RuntimeError", []);
                """);
        registry.type("_pyexc_NotImplementedError", """
                function _pyexc_NotImplementedError() {
                    return _pyfunc_op_instantiate(_pyexc_NotImplementedError, this, arguments);
                }
                _pyfunc_op_extends(_pyexc_NotImplementedError, _pyexc_RuntimeError, "NotImplementedError", []);
                """);
        registry.type("_pyexc_AssertionError", """
                function _pyexc_AssertionError() {
                    return _pyfunc_op_instantiate(_pyexc_AssertionError, this, arguments);
                }
                _pyfunc_op_extends(_pyexc_AssertionError, _pyexc_Exception, "AssertionError", []);
                """);
        registry.type("_pyexc_StopIteration", """
                function _pyexc_StopIteration() {
                    return _pyfunc_op_instantiate(_pyexc_StopIteration, this, arguments);
                }
                _pyfunc_op_extends(_pyexc_StopIteration, _pyexc_Exception, "StopIteration", []);
                """);
    }
}
