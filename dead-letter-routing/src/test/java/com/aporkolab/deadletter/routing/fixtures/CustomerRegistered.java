package com.aporkolab.deadletter.routing.fixtures;

public class CustomerRegistered {
}
