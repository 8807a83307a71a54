package com.example;

class Broken {
    void oops( {
}
